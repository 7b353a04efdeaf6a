package com.attendance.tracker.model.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Dates are DD-MM-YYYY, both inclusive. A missing reason is stored as the configured default.
 */
public record AbsenceRequest(
        @NotNull Long employeeId,
        String startDate,
        String endDate,
        String reason) {
}
