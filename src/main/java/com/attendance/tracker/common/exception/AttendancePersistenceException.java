package com.attendance.tracker.common.exception;

/**
 * Exception thrown when attendance records could not be written to the store.
 * Records written before the failure stay in place; the operation is safe to retry.
 */
public class AttendancePersistenceException extends BaseAttendanceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-002";

    public AttendancePersistenceException(String message) {
        super(message);
    }

    public AttendancePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
