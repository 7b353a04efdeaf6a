package com.attendance.tracker.model.dto;

import com.attendance.tracker.common.DateFormats;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;

/**
 * Published when a collection session has been written.
 */
public record CollectionSummary(
        String adminId,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN) LocalDate date,
        int presentCount,
        int absentCount) {
}
