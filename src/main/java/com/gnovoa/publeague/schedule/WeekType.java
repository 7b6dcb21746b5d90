package com.gnovoa.publeague.schedule;

import java.util.Locale;
import java.util.Optional;

public enum WeekType {
    REGULAR("Regular Season"),
    PLAYOFF("Playoffs"),
    MIXED("Mixed Week"),
    PRACTICE("Practice Session"),
    FUN("Fun Week"),
    TST("The Soccer Tournament"),
    BYE("BYE Week"),
    BONUS("Bonus Week");

    private final String displayName;

    WeekType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Lenient parse, empty for anything not listed here. */
    public static Optional<WeekType> parse(String tag) {
        if (tag == null) return Optional.empty();
        try {
            return Optional.of(WeekType.valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
