package com.attendance.tracker.enums;

/**
 * Classification of one employee on one day, as shown in reports.
 */
public enum DayStatus {
    PRESENT,
    ABSENT,
    UNMARKED,
    NON_WORKING;

    public static DayStatus of(AttendanceStatus status) {
        if (status == null) return UNMARKED;
        return status == AttendanceStatus.PRESENT ? PRESENT : ABSENT;
    }
}
