package com.attendance.tracker.model.dto;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.enums.DayStatus;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.List;

public record DailyReport(
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate date,
        String holiday,
        List<Entry> entries,
        int presentCount,
        int absentCount,
        int unmarkedCount) {

    public record Entry(long employeeId, String name, boolean active, DayStatus status, String reason) {
    }
}
