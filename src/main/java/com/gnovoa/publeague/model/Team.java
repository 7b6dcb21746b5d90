package com.gnovoa.publeague.model;

/**
 * A team taking part in a division.
 *
 * <p>Real teams carry the positive id assigned by the team store. Placeholder teams (fun week,
 * bye, tournament) carry a negative id and only live for the duration of one generation run.
 */
public record Team(int teamId, String name, String divisionId) {

    public boolean isPlaceholder() {
        return teamId < 0;
    }

    public Team inDivision(String divisionId) {
        return new Team(teamId, name, divisionId);
    }
}
