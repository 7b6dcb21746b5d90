package com.gnovoa.publeague.schedule;

import java.util.List;

/** Result of auditing an already built list of regular season rows. */
public record ScheduleAudit(
        int totalMatches,
        int expectedMatches,
        boolean c1DoubleRoundRobin,
        boolean c2BackToBack,
        boolean c3NoImmediateRematch,
        boolean c4HomeAwayBalance,
        boolean c5FieldBalance,
        boolean c6TimeBalance,
        List<String> violations
) {
    public boolean hardConstraintsSatisfied() {
        return totalMatches == expectedMatches && c1DoubleRoundRobin && c2BackToBack
                && c3NoImmediateRematch && c4HomeAwayBalance;
    }

    public boolean allConstraintsSatisfied() {
        return hardConstraintsSatisfied() && c5FieldBalance && c6TimeBalance;
    }
}
