package com.gnovoa.publeague.exception;

public class MissingWeekDateException extends SchedulingException {

    public MissingWeekDateException(int weekNumber) {
        super("MISSING_WEEK_DATE", "Week " + weekNumber + " has no date", weekNumber);
    }
}
