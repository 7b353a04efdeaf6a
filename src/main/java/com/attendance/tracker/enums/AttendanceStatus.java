package com.attendance.tracker.enums;

/**
 * Status stored on an attendance record. Unmarked days have no record at all.
 */
public enum AttendanceStatus {
    PRESENT,
    ABSENT
}
