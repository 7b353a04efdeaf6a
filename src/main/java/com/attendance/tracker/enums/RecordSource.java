package com.attendance.tracker.enums;

/**
 * Which workflow wrote an attendance record.
 */
public enum RecordSource {
    COLLECTION,
    MULTIDAY_ABSENCE
}
