package com.attendance.tracker.model.dto;

public record ReasonRequest(String reason) {
}
