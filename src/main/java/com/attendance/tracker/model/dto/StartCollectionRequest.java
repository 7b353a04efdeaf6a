package com.attendance.tracker.model.dto;

/**
 * @param date DD-MM-YYYY, omitted for today
 */
public record StartCollectionRequest(String date) {
}
