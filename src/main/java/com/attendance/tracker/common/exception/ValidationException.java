package com.attendance.tracker.common.exception;

/**
 * Exception for validation errors: malformed dates, inverted ranges, missing reasons,
 * events that do not fit the current collection step.
 */
public class ValidationException extends BaseAttendanceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
