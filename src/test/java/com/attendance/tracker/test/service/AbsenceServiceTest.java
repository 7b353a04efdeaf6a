package com.attendance.tracker.test.service;

import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.constants.StreamTopics;
import com.attendance.tracker.common.exception.EntityNotFoundException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.config.AttendanceProperties;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.model.documents.Employee;
import com.attendance.tracker.model.documents.Holiday;
import com.attendance.tracker.model.dto.AbsenceResult;
import com.attendance.tracker.service.attendance.AbsenceService;
import com.attendance.tracker.service.attendance.AttendanceRecordService;
import com.attendance.tracker.service.calendar.HolidayService;
import com.attendance.tracker.service.calendar.WorkingDayCalendar;
import com.attendance.tracker.service.employee.EmployeeService;
import com.attendance.tracker.service.streaming.StreamGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AbsenceServiceTest {

    static final LocalDate JUL_15 = LocalDate.of(2025, 7, 15);
    static final LocalDate JUL_18 = LocalDate.of(2025, 7, 18);

    @Mock
    EmployeeService employeeService;
    @Mock
    HolidayService holidayService;
    @Mock
    AttendanceRecordService recordService;
    @Mock
    StreamGateway stream;

    AttendanceProperties props;
    AbsenceService service;

    @BeforeEach
    void setUp() {
        props = new AttendanceProperties();
        WorkingDayCalendar calendar = new WorkingDayCalendar(holidayService, props);
        service = new AbsenceService(employeeService, calendar, recordService, stream, props);
    }

    private void activeEmployee(long id) {
        when(employeeService.getActive(id)).thenReturn(Employee.builder().id(id).name("Asha").active(true).build());
    }

    private void writesSucceed() {
        when(recordService.upsert(anyLong(), any(), any(), any(), any())).thenReturn(Result.ok(new AttendanceRecord()));
    }

    @Test
    void marksEveryDateOfTheRangeAbsent() {
        activeEmployee(1);
        writesSucceed();
        when(holidayService.listBetween(JUL_15, JUL_18)).thenReturn(List.of());

        AbsenceResult result = service.recordAbsence(1, JUL_15, JUL_18, "Vacation");

        assertThat(result.markedDates()).containsExactly("15-07-2025", "16-07-2025", "17-07-2025", "18-07-2025");
        assertThat(result.skippedDates()).isEmpty();
        for (LocalDate d = JUL_15; !d.isAfter(JUL_18); d = d.plusDays(1)) {
            verify(recordService).upsert(1L, d, AttendanceStatus.ABSENT, "Vacation", RecordSource.MULTIDAY_ABSENCE);
        }
        verify(recordService, times(4)).upsert(anyLong(), any(), any(), any(), any());
        verify(stream).send(StreamTopics.ABSENCE_RECORDED, result);
    }

    @Test
    void invertedRangeWritesNothing() {
        assertThatThrownBy(() -> service.recordAbsence(1, JUL_18, JUL_15, "Vacation"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Start date must be before end date");
        verifyNoInteractions(recordService, employeeService);
    }

    @Test
    void unknownOrInactiveEmployeeIsNotFound() {
        when(employeeService.getActive(9L)).thenThrow(new EntityNotFoundException("Employee", 9L));

        assertThatThrownBy(() -> service.recordAbsence(9, JUL_15, JUL_18, "Vacation"))
                .isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(recordService);
    }

    @Test
    void blankReasonFallsBackToDefault() {
        activeEmployee(1);
        writesSucceed();
        when(holidayService.listBetween(JUL_15, JUL_15)).thenReturn(List.of());

        AbsenceResult result = service.recordAbsence(1, JUL_15, JUL_15, "  ");

        assertThat(result.reason()).isEqualTo("Not specified");
        verify(recordService).upsert(1L, JUL_15, AttendanceStatus.ABSENT, "Not specified", RecordSource.MULTIDAY_ABSENCE);
    }

    @Test
    void holidaysAreWrittenByDefault() {
        activeEmployee(1);
        writesSucceed();
        when(holidayService.listBetween(JUL_15, JUL_18))
                .thenReturn(List.of(Holiday.builder().date(LocalDate.of(2025, 7, 16)).description("Festival").build()));

        AbsenceResult result = service.recordAbsence(1, JUL_15, JUL_18, "Vacation");

        assertThat(result.markedDates()).hasSize(4);
        assertThat(result.skippedDates()).isEmpty();
    }

    @Test
    void nonWorkingDaysAreSkippedWhenConfigured() {
        props.getAbsence().setSkipNonWorkingDays(true);
        props.getCalendar().setWeeklyOffDays(EnumSet.of(DayOfWeek.SUNDAY));
        activeEmployee(1);
        writesSucceed();
        // 19-07-2025 is a Saturday, 20-07-2025 a Sunday
        LocalDate end = LocalDate.of(2025, 7, 21);
        when(holidayService.listBetween(JUL_15, end))
                .thenReturn(List.of(Holiday.builder().date(LocalDate.of(2025, 7, 16)).description("Festival").build()));

        AbsenceResult result = service.recordAbsence(1, JUL_15, end, "Vacation");

        assertThat(result.skippedDates()).containsExactly("16-07-2025", "20-07-2025");
        assertThat(result.markedDates()).containsExactly("15-07-2025", "17-07-2025", "18-07-2025", "19-07-2025", "21-07-2025");
        verify(recordService, never()).upsert(eq(1L), eq(LocalDate.of(2025, 7, 16)), any(), any(), any());
    }

    @Test
    void rangeLongerThanLimitIsRejected() {
        props.getAbsence().setMaxDays(3);

        assertThatThrownBy(() -> service.recordAbsence(1, JUL_15, JUL_18, "Vacation"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("exceeds");
        verifyNoInteractions(recordService);
    }
}
