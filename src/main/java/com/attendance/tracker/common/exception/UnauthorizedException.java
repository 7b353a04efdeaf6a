package com.attendance.tracker.common.exception;

public class UnauthorizedException extends BaseAttendanceException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AUTH-001";

    public UnauthorizedException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
