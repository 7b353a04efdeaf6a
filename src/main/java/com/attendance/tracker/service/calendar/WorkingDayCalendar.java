package com.attendance.tracker.service.calendar;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.config.AttendanceProperties;
import com.attendance.tracker.model.documents.Holiday;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which dates count. A working day is neither a holiday nor a configured weekly off day.
 */
@Component
@RequiredArgsConstructor
public class WorkingDayCalendar {

    private final HolidayService holidayService;
    private final AttendanceProperties props;

    public boolean isWorkingDay(LocalDate date) {
        return nonWorkingReason(date).isEmpty();
    }

    /**
     * Human readable reason why the date is not a working day, empty when it is one.
     */
    public Optional<String> nonWorkingReason(LocalDate date) {
        Optional<Holiday> holiday = holidayService.find(date);
        if (holiday.isPresent()) {
            return Optional.of(DateFormats.format(date) + " is a holiday: " + holiday.get().getDescription());
        }
        if (weeklyOffDays().contains(date.getDayOfWeek())) {
            return Optional.of(DateFormats.format(date) + " is a weekly off day");
        }
        return Optional.empty();
    }

    /**
     * Loads the holidays of [from, to] once so callers can classify many dates without a query each.
     */
    public Span span(LocalDate from, LocalDate to) {
        Map<LocalDate, Holiday> byDate = new LinkedHashMap<>();
        for (Holiday h : holidayService.listBetween(from, to)) {
            byDate.put(h.getDate(), h);
        }
        return new Span(from, to, byDate, weeklyOffDays());
    }

    private Set<DayOfWeek> weeklyOffDays() {
        Set<DayOfWeek> configured = props.getCalendar().getWeeklyOffDays();
        return configured == null || configured.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(configured);
    }

    /**
     * Inclusive date range with its holidays resolved.
     */
    public static final class Span {
        private final LocalDate from;
        private final LocalDate to;
        private final Map<LocalDate, Holiday> holidays;
        private final Set<DayOfWeek> offDays;

        Span(LocalDate from, LocalDate to, Map<LocalDate, Holiday> holidays, Set<DayOfWeek> offDays) {
            this.from = from;
            this.to = to;
            this.holidays = holidays;
            this.offDays = offDays;
        }

        public boolean isWorkingDay(LocalDate date) {
            return !holidays.containsKey(date) && !offDays.contains(date.getDayOfWeek());
        }

        public List<LocalDate> dates() {
            List<LocalDate> out = new ArrayList<>();
            for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) out.add(d);
            return out;
        }

        public List<LocalDate> workingDays() {
            List<LocalDate> out = new ArrayList<>();
            for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
                if (isWorkingDay(d)) out.add(d);
            }
            return out;
        }

        public List<Holiday> holidays() {
            return Collections.unmodifiableList(new ArrayList<>(holidays.values()));
        }
    }
}
