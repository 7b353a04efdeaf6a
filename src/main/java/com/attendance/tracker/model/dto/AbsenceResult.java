package com.attendance.tracker.model.dto;

import com.attendance.tracker.common.DateFormats;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a multi-day absence. Dates in the lists are DD-MM-YYYY.
 */
public record AbsenceResult(
        long employeeId,
        String employeeName,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate startDate,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate endDate,
        String reason,
        List<String> markedDates,
        List<String> skippedDates) {
}
