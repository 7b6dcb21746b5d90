package com.gnovoa.publeague.exception;

public class DivisionNotFoundException extends SchedulingException {

    public DivisionNotFoundException(String divisionId) {
        super("DIVISION_NOT_FOUND", "Division " + divisionId + " not found", divisionId);
    }
}
