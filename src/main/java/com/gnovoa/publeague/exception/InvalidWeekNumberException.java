package com.gnovoa.publeague.exception;

public class InvalidWeekNumberException extends SchedulingException {

    public InvalidWeekNumberException(int weekNumber, int maxWeekNumber) {
        super("INVALID_WEEK_NUMBER",
                "Week index " + weekNumber + " is outside [0," + maxWeekNumber + "]",
                weekNumber, maxWeekNumber);
    }
}
