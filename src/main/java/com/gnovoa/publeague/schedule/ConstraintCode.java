package com.gnovoa.publeague.schedule;

/**
 * Invariants a generated season is checked against. Advisory codes are reported but the
 * generator never promises to satisfy them.
 */
public enum ConstraintCode {
    C1_DOUBLE_ROUND_ROBIN("each pair meets exactly twice", false),
    C2_BACK_TO_BACK("two games per team per week, in one window", false),
    C3_NO_IMMEDIATE_REMATCH("no opponent repeated in consecutive weeks", false),
    C4_HOME_AWAY_BALANCE("equal home and away games", false),
    C5_FIELD_BALANCE("equal games on each field", true),
    C6_TIME_BALANCE("early and late windows within one of each other", true),
    PARTIAL_CYCLE("rotation stopped part-way through a cycle", true),
    UNKNOWN_WEEK_TYPE("week type not recognised", true);

    private final String description;
    private final boolean advisory;

    ConstraintCode(String description, boolean advisory) {
        this.description = description;
        this.advisory = advisory;
    }

    public String description() {
        return description;
    }

    public boolean advisory() {
        return advisory;
    }

    /** Short tag used in messages: "C1".."C6", or the full name for the others. */
    public String label() {
        String n = name();
        return n.charAt(0) == 'C' && Character.isDigit(n.charAt(1)) ? n.substring(0, 2) : n;
    }
}
