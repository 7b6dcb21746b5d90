package com.gnovoa.publeague.exception;

/**
 * Root of the fatal scheduling errors. Anything thrown from this hierarchy aborts the whole
 * generation call; recoverable problems go to a {@code ViolationReport} instead.
 */
public class SchedulingException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public SchedulingException(String message) {
        super(message);
        this.errorCode = "SCHEDULING_ERROR";
        this.parameters = new Object[0];
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCHEDULING_ERROR";
        this.parameters = new Object[0];
    }

    public SchedulingException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public SchedulingException(String errorCode, String message, Throwable cause, Object... parameters) {
        super(message, cause);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters.clone();
    }
}
