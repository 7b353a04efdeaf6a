package com.attendance.tracker.service.attendance;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.constants.StreamTopics;
import com.attendance.tracker.common.exception.AttendancePersistenceException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.config.AttendanceProperties;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.model.documents.Employee;
import com.attendance.tracker.model.dto.AbsenceResult;
import com.attendance.tracker.service.calendar.WorkingDayCalendar;
import com.attendance.tracker.service.employee.EmployeeService;
import com.attendance.tracker.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Marks one employee absent for every date of an inclusive range, overwriting whatever was there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AbsenceService {

    private final EmployeeService employeeService;
    private final WorkingDayCalendar calendar;
    private final AttendanceRecordService recordService;
    private final StreamGateway stream;
    private final AttendanceProperties props;

    public AbsenceResult recordAbsence(long employeeId, LocalDate startDate, LocalDate endDate, @Nullable String reason) {
        if (startDate.isAfter(endDate)) {
            throw new ValidationException("Start date must be before end date");
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
        int maxDays = props.getAbsence().getMaxDays();
        if (days > maxDays) {
            throw new ValidationException("Absence range of " + days + " days exceeds the limit of " + maxDays);
        }
        Employee employee = employeeService.getActive(employeeId);
        String why = StringUtils.hasText(reason) ? reason.trim() : props.getAbsence().getDefaultReason();
        boolean skipNonWorking = props.getAbsence().isSkipNonWorkingDays();

        WorkingDayCalendar.Span span = calendar.span(startDate, endDate);
        List<String> marked = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int failures = 0;
        for (LocalDate d : span.dates()) {
            if (skipNonWorking && !span.isWorkingDay(d)) {
                skipped.add(DateFormats.format(d));
                continue;
            }
            Result<AttendanceRecord> r = recordService.upsert(employeeId, d, AttendanceStatus.ABSENT, why, RecordSource.MULTIDAY_ABSENCE);
            if (r.isOk()) {
                marked.add(DateFormats.format(d));
            } else {
                failures++;
            }
        }
        if (failures > 0) {
            log.error("Absence for employee {}: {} of {} dates could not be saved", employeeId, failures, days - skipped.size());
            throw new AttendancePersistenceException(failures + " of " + (days - skipped.size())
                    + " absence records could not be saved; the request is safe to repeat");
        }

        AbsenceResult result = new AbsenceResult(employeeId, employee.getName(), startDate, endDate, why, marked, skipped);
        log.info("Marked {} absent from {} to {} ({} days, {} skipped)", employee.getName(),
                DateFormats.format(startDate), DateFormats.format(endDate), marked.size(), skipped.size());
        stream.send(StreamTopics.ABSENCE_RECORDED, result);
        return result;
    }
}
