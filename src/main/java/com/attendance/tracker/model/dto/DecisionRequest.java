package com.attendance.tracker.model.dto;

import com.attendance.tracker.enums.AttendanceStatus;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;

/**
 * @param employeeId optional; when given it must match the employee currently being asked about
 */
public record DecisionRequest(
        @NotNull @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES) AttendanceStatus decision,
        Long employeeId) {
}
