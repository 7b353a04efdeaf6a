package com.attendance.tracker.service.report;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive range of dates.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new ValidationException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new ValidationException("Start date " + DateFormats.format(start)
                    + " must not be after end date " + DateFormats.format(end));
        }
    }

    public int days() {
        return (int) ChronoUnit.DAYS.between(start, end) + 1;
    }
}
