package com.attendance.tracker.common.exception;

/**
 * Exception thrown when an employee, holiday or collection session does not exist.
 */
public class EntityNotFoundException extends BaseAttendanceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, Long id) {
        super(String.format("%s with id %d not found", entityType, id));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
