package com.attendance.tracker.service.report;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Named windows, all ending today except CALENDAR_MONTH which covers a whole month.
 */
public enum ReportPeriod {
    LAST_7_DAYS,
    LAST_30_DAYS,
    CALENDAR_MONTH;

    /**
     * CALENDAR_MONTH resolves to the month containing today.
     */
    public DateRange resolve(LocalDate today) {
        return switch (this) {
            case LAST_7_DAYS -> new DateRange(today.minusDays(6), today);
            case LAST_30_DAYS -> new DateRange(today.minusDays(29), today);
            case CALENDAR_MONTH -> month(YearMonth.from(today));
        };
    }

    public static DateRange month(YearMonth month) {
        return new DateRange(month.atDay(1), month.atEndOfMonth());
    }
}
