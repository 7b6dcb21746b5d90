package com.gnovoa.publeague.lifecycle;

import java.time.LocalDate;
import java.time.LocalTime;

/** Turns a committed template row into a real match and returns the new match id. */
public interface MatchCreator {

    long createMatch(
            LocalDate date,
            LocalTime time,
            String field,
            int homeTeamId,
            int awayTeamId,
            int weekNumber,
            String weekType,
            boolean special,
            boolean playoff,
            Integer playoffRound);

    /** Removes a match created by {@link #createMatch}. Used to undo a commit that failed part-way. */
    void deleteMatch(long matchId);
}
