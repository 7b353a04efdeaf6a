package com.attendance.tracker.model.dto;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.enums.DayStatus;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.List;

public record EmployeeReport(
        long employeeId,
        String name,
        boolean active,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate startDate,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate endDate,
        int workingDayCount,
        EmployeeTally tally,
        List<TrendDay> weeklyTrend,
        List<AbsenceEntry> recentAbsences) {

    public record TrendDay(
            @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate date,
            DayStatus status) {
    }

    public record AbsenceEntry(
            @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate date,
            String reason) {
    }
}
