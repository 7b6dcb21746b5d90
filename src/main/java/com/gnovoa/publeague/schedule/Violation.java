package com.gnovoa.publeague.schedule;

/** A single failed check. {@code weekNumber} is 1-based and null for season-wide checks. */
public record Violation(ConstraintCode code, Integer weekNumber, String message) {

    public boolean advisory() {
        return code.advisory();
    }

    @Override
    public String toString() {
        return (weekNumber == null ? "" : "Week " + weekNumber + ": ") + "[" + code.label() + "] " + message;
    }
}
