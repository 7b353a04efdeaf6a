package com.attendance.tracker.model.dto;

/**
 * Per-employee counts over the working days of a range.
 * presentDays + absentDays + unmarkedDays equals the working day count of the range.
 */
public record EmployeeTally(
        long employeeId,
        String name,
        int presentDays,
        int absentDays,
        int unmarkedDays,
        int attendanceRate) {
}
