package com.attendance.tracker.common.exception;

import lombok.Getter;

/**
 * Base exception class for all attendance application exceptions.
 * Carries the error code the web layer maps to a response status.
 */
@Getter
public abstract class BaseAttendanceException extends RuntimeException {
    private final String errorCode;

    public BaseAttendanceException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    public BaseAttendanceException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
