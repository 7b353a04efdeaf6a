package com.attendance.tracker.model.dto;

import com.attendance.tracker.common.DateFormats;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.List;

public record PeriodReport(
        String period,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate startDate,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate endDate,
        int calendarDays,
        int workingDayCount,
        List<HolidayEntry> holidays,
        List<EmployeeTally> perEmployee,
        int totalPresent,
        int totalAbsent,
        List<EmployeeTally> topPerformers,
        List<EmployeeTally> needsImprovement,
        List<ReasonCount> topAbsenceReasons) {

    public record HolidayEntry(
            @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate date,
            String description) {
    }

    public record ReasonCount(String reason, long count) {
    }
}
