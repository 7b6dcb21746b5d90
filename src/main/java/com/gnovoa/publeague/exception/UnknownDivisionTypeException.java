package com.gnovoa.publeague.exception;

public class UnknownDivisionTypeException extends SchedulingException {

    public UnknownDivisionTypeException(String divisionType) {
        super("UNKNOWN_DIVISION_TYPE", "Unknown league type: " + divisionType, divisionType);
    }
}
