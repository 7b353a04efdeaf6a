package com.attendance.tracker.common.exception;

/**
 * Raised when a write would break a uniqueness rule: a second holiday on the same date,
 * or a second collection session for the same administrator.
 */
public class ConflictException extends BaseAttendanceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CONFLICT";

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
