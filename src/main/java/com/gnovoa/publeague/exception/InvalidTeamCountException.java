package com.gnovoa.publeague.exception;

public class InvalidTeamCountException extends SchedulingException {

    public InvalidTeamCountException(int teamCount) {
        super("INVALID_TEAM_COUNT",
                "Pairings can only be generated for 4 or 8 teams, got " + teamCount,
                teamCount);
    }
}
