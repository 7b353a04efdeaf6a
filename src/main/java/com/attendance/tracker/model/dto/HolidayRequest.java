package com.attendance.tracker.model.dto;

/**
 * @param date DD-MM-YYYY, omitted for today
 */
public record HolidayRequest(String date, String description) {
}
