package com.attendance.tracker.model.dto;

public record EmployeeRequest(String name) {
}
