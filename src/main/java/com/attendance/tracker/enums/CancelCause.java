package com.attendance.tracker.enums;

public enum CancelCause {
    ADMIN,
    TIMEOUT
}
