package com.gnovoa.publeague.schedule;

import com.gnovoa.publeague.exception.InvalidWeekNumberException;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed pairing designs, expressed as positions into the ascending list of team ids.
 *
 * <p>Each week lists its matches in slot order: two matches per time slot, the first one on the
 * first field. For the 8 team table, positions 0..3 of a week form the early window and 4..7 the
 * late window, and every team plays its two games inside one window.
 *
 * <p>The 8 team table satisfies, over its 7 weeks: every pair meets exactly twice, two games per
 * team per week, no opponent repeated in consecutive weeks, 7 home and 7 away games per team,
 * 7 games per team on each field, and 3 or 4 early windows per team.
 */
public final class PairingTables {

    public static final int PREMIER_TEAM_COUNT = 8;
    public static final int PREMIER_WEEKS = 7;
    public static final int CLASSIC_TEAM_COUNT = 4;
    public static final int CLASSIC_CYCLE = 3;

    // Letters A..H, as 0-based positions.
    private static final int[][][] PREMIER = {
            {{0, 1}, {2, 3}, {0, 2}, {1, 3}, {4, 5}, {6, 7}, {4, 6}, {5, 7}},
            {{4, 0}, {7, 3}, {3, 4}, {7, 0}, {6, 1}, {5, 2}, {1, 2}, {5, 6}},
            {{4, 5}, {3, 6}, {5, 3}, {6, 4}, {7, 2}, {0, 1}, {7, 1}, {0, 2}},
            {{7, 4}, {3, 0}, {7, 0}, {3, 4}, {1, 5}, {2, 6}, {6, 1}, {2, 5}},
            {{0, 5}, {6, 7}, {6, 0}, {5, 7}, {2, 4}, {1, 3}, {3, 2}, {4, 1}},
            {{5, 6}, {1, 2}, {2, 6}, {1, 5}, {3, 0}, {4, 7}, {3, 7}, {4, 0}},
            {{7, 1}, {2, 4}, {2, 7}, {1, 4}, {5, 3}, {0, 6}, {6, 3}, {0, 5}},
    };

    // Three perfect matchings of K4, each used twice per cycle; 3 home and 3 away games per team.
    private static final int[][][] CLASSIC = {
            {{0, 1}, {2, 3}, {0, 2}, {1, 3}},
            {{0, 3}, {1, 2}, {3, 2}, {1, 0}},
            {{3, 1}, {2, 0}, {2, 1}, {3, 0}},
    };

    private PairingTables() {
    }

    /**
     * Returns week {@code weekNum} of the 8 team table for the given ascending team ids.
     *
     * @throws InvalidWeekNumberException if {@code weekNum} is outside [0,6]
     */
    public static List<MatchSlot> premierWeek(int weekNum, List<Integer> sortedTeamIds) {
        if (weekNum < 0 || weekNum >= PREMIER_WEEKS) {
            throw new InvalidWeekNumberException(weekNum, PREMIER_WEEKS - 1);
        }
        return map(PREMIER[weekNum], sortedTeamIds);
    }

    /** Returns the classic rotation week for {@code weekNum}, cycling every 3 weeks. */
    public static List<MatchSlot> classicWeek(int weekNum, List<Integer> sortedTeamIds) {
        return map(CLASSIC[Math.floorMod(weekNum, CLASSIC_CYCLE)], sortedTeamIds);
    }

    private static List<MatchSlot> map(int[][] week, List<Integer> ids) {
        List<MatchSlot> out = new ArrayList<>(week.length);
        for (int[] m : week) out.add(new MatchSlot(ids.get(m[0]), ids.get(m[1])));
        return List.copyOf(out);
    }
}
