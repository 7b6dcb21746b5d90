package com.gnovoa.publeague.model;

import com.gnovoa.publeague.exception.UnknownDivisionTypeException;

import java.util.Locale;

/**
 * League division flavours. Each one carries its own clock layout and season defaults.
 */
public enum DivisionType {
    PREMIER(8),
    CLASSIC(4),
    ECS_FC(4);

    private final int teamCount;

    DivisionType(int teamCount) {
        this.teamCount = teamCount;
    }

    /** Real teams a roster of this type must have. */
    public int teamCount() {
        return teamCount;
    }

    public static DivisionType fromName(String name) {
        if (name == null || name.isBlank()) throw new UnknownDivisionTypeException(String.valueOf(name));
        try {
            return DivisionType.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnknownDivisionTypeException(name);
        }
    }
}
