package com.attendance.tracker.core;

import com.attendance.tracker.enums.AttendanceStatus;

import java.time.LocalDate;

/**
 * A decision taken during a session, not yet written.
 */
public record PendingRecord(long employeeId, String employeeName, LocalDate date, AttendanceStatus status, String reason) {
}
