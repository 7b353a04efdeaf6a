package com.attendance.tracker.test.service;

import com.attendance.tracker.config.AttendanceProperties;
import com.attendance.tracker.model.documents.Holiday;
import com.attendance.tracker.service.calendar.HolidayService;
import com.attendance.tracker.service.calendar.WorkingDayCalendar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkingDayCalendarTest {

    // Tuesday
    static final LocalDate JUL_15 = LocalDate.of(2025, 7, 15);
    static final LocalDate JUL_20 = LocalDate.of(2025, 7, 20);

    @Mock
    HolidayService holidayService;

    AttendanceProperties props;
    WorkingDayCalendar calendar;

    @BeforeEach
    void setUp() {
        props = new AttendanceProperties();
        calendar = new WorkingDayCalendar(holidayService, props);
    }

    private static Holiday holiday(LocalDate date, String description) {
        return Holiday.builder().date(date).description(description).build();
    }

    @Test
    void everyDayWorksWithoutHolidaysOrOffDays() {
        when(holidayService.find(JUL_20)).thenReturn(Optional.empty());

        assertThat(calendar.isWorkingDay(JUL_20)).isTrue();
    }

    @Test
    void holidayReasonNamesTheDescription() {
        when(holidayService.find(JUL_15)).thenReturn(Optional.of(holiday(JUL_15, "Founders Day")));

        assertThat(calendar.isWorkingDay(JUL_15)).isFalse();
        assertThat(calendar.nonWorkingReason(JUL_15)).contains("15-07-2025 is a holiday: Founders Day");
    }

    @Test
    void configuredWeeklyOffDayIsNotWorking() {
        props.getCalendar().setWeeklyOffDays(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
        when(holidayService.find(JUL_20)).thenReturn(Optional.empty());

        assertThat(calendar.nonWorkingReason(JUL_20)).contains("20-07-2025 is a weekly off day");
    }

    @Test
    void spanClassifiesEachDateFromOneLookup() {
        props.getCalendar().setWeeklyOffDays(EnumSet.of(DayOfWeek.SUNDAY));
        when(holidayService.listBetween(JUL_15, JUL_20)).thenReturn(List.of(holiday(JUL_15.plusDays(1), "Festival")));

        WorkingDayCalendar.Span span = calendar.span(JUL_15, JUL_20);

        assertThat(span.dates()).hasSize(6);
        assertThat(span.workingDays()).containsExactly(
                JUL_15, JUL_15.plusDays(2), JUL_15.plusDays(3), JUL_15.plusDays(4));
        assertThat(span.holidays()).extracting(Holiday::getDescription).containsExactly("Festival");
    }
}
