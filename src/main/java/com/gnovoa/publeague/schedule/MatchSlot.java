package com.gnovoa.publeague.schedule;

/**
 * One pairing produced by {@link PairingGenerator}. Home equal to away marks a special event
 * placeholder rather than a real match.
 */
public record MatchSlot(int homeTeamId, int awayTeamId) {

    public boolean isSpecialEvent() {
        return homeTeamId == awayTeamId;
    }

    public boolean involves(int teamId) {
        return homeTeamId == teamId || awayTeamId == teamId;
    }

    public int opponentOf(int teamId) {
        if (homeTeamId == teamId) return awayTeamId;
        if (awayTeamId == teamId) return homeTeamId;
        throw new IllegalArgumentException("Team " + teamId + " is not part of " + this);
    }

    /** Order-independent key, {@code "{min}_{max}"}. */
    public String pairKey() {
        return pairKey(homeTeamId, awayTeamId);
    }

    public static String pairKey(int a, int b) {
        return Math.min(a, b) + "_" + Math.max(a, b);
    }
}
