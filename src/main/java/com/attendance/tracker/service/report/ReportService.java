package com.attendance.tracker.service.report;

import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.DayStatus;
import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.model.documents.Employee;
import com.attendance.tracker.model.documents.Holiday;
import com.attendance.tracker.model.dto.DailyReport;
import com.attendance.tracker.model.dto.EmployeeReport;
import com.attendance.tracker.model.dto.EmployeeTally;
import com.attendance.tracker.model.dto.PeriodReport;
import com.attendance.tracker.repo.documents.AttendanceRecordRepo;
import com.attendance.tracker.service.calendar.HolidayService;
import com.attendance.tracker.service.calendar.WorkingDayCalendar;
import com.attendance.tracker.service.employee.EmployeeService;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side. Builds reports from employees, attendance records and the working day calendar;
 * never writes.
 */
@Service
@RequiredArgsConstructor
public class ReportService {

    private static final int TOP_N = 3;

    private static final Comparator<EmployeeTally> BY_RATE_DESC =
            Comparator.comparingInt(EmployeeTally::attendanceRate).reversed().thenComparingLong(EmployeeTally::employeeId);
    private static final Comparator<EmployeeTally> BY_RATE_ASC =
            Comparator.comparingInt(EmployeeTally::attendanceRate).thenComparingLong(EmployeeTally::employeeId);

    private final EmployeeService employeeService;
    private final HolidayService holidayService;
    private final WorkingDayCalendar calendar;
    private final AttendanceRecordRepo recordRepo;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Every active employee plus inactive ones that have a record on the date, ordered by id.
     */
    public DailyReport dailyReport(LocalDate date) {
        Map<Long, AttendanceRecord> byEmployee = new HashMap<>();
        for (AttendanceRecord r : recordRepo.findByDate(date)) {
            byEmployee.put(r.getEmployeeId(), r);
        }

        List<DailyReport.Entry> entries = new ArrayList<>();
        int present = 0, absent = 0, unmarked = 0;
        for (Employee e : employeeService.list(false)) {
            AttendanceRecord r = byEmployee.get(e.getId());
            if (!e.isActive() && r == null) continue;
            DayStatus status = DayStatus.of(r == null ? null : r.getStatus());
            switch (status) {
                case PRESENT -> present++;
                case ABSENT -> absent++;
                default -> unmarked++;
            }
            entries.add(new DailyReport.Entry(e.getId(), e.getName(), e.isActive(), status,
                    r != null && r.isAbsent() ? r.getReason() : null));
        }
        String holiday = holidayService.find(date).map(Holiday::getDescription).orElse(null);
        return new DailyReport(date, holiday, entries, present, absent, unmarked);
    }

    public PeriodReport periodReport(LocalDate startDate, LocalDate endDate) {
        return periodReport(new DateRange(startDate, endDate), null);
    }

    public PeriodReport periodReport(ReportPeriod period) {
        return periodReport(period.resolve(today()), period.name());
    }

    /**
     * @param month null means the current month
     */
    public PeriodReport monthlyReport(@Nullable YearMonth month) {
        YearMonth ym = month == null ? YearMonth.from(today()) : month;
        return periodReport(ReportPeriod.month(ym), ReportPeriod.CALENDAR_MONTH.name());
    }

    public EmployeeReport employeeReport(long employeeId, @Nullable LocalDate startDate, @Nullable LocalDate endDate) {
        Employee employee = employeeService.get(employeeId);
        LocalDate end = endDate == null ? today() : endDate;
        DateRange range = startDate == null
                ? ReportPeriod.LAST_30_DAYS.resolve(end)
                : new DateRange(startDate, end);

        LocalDate trendStart = range.end().minusDays(6);
        LocalDate from = trendStart.isBefore(range.start()) ? trendStart : range.start();
        Map<LocalDate, AttendanceRecord> byDate = new HashMap<>();
        for (AttendanceRecord r : recordRepo.findByEmployeeIdAndDateBetween(employeeId, from, range.end())) {
            byDate.put(r.getDate(), r);
        }

        WorkingDayCalendar.Span span = calendar.span(range.start(), range.end());
        AttendanceTally tally = new AttendanceTally(employee.getId(), employee.getName());
        List<LocalDate> workingDays = span.workingDays();
        for (LocalDate d : workingDays) {
            tally.add(classify(byDate.get(d)));
        }

        WorkingDayCalendar.Span week = calendar.span(trendStart, range.end());
        List<EmployeeReport.TrendDay> trend = new ArrayList<>();
        for (LocalDate d : week.dates()) {
            DayStatus status = week.isWorkingDay(d) ? classify(byDate.get(d)) : DayStatus.NON_WORKING;
            trend.add(new EmployeeReport.TrendDay(d, status));
        }

        List<EmployeeReport.AbsenceEntry> recent = new ArrayList<>();
        for (AttendanceRecord r : recordRepo.findTop3ByEmployeeIdAndStatusOrderByDateDesc(employeeId, AttendanceStatus.ABSENT)) {
            recent.add(new EmployeeReport.AbsenceEntry(r.getDate(), r.getReason()));
        }

        return new EmployeeReport(employee.getId(), employee.getName(), employee.isActive(),
                range.start(), range.end(), workingDays.size(), tally.toTally(), trend, recent);
    }

    private PeriodReport periodReport(DateRange range, @Nullable String label) {
        WorkingDayCalendar.Span span = calendar.span(range.start(), range.end());
        List<LocalDate> workingDays = span.workingDays();
        List<Employee> employees = employeeService.list(true);

        // employeeId -> date -> record
        Map<Long, Map<LocalDate, AttendanceRecord>> index = new HashMap<>();
        for (AttendanceRecord r : recordRepo.findByDateBetween(range.start(), range.end())) {
            index.computeIfAbsent(r.getEmployeeId(), k -> new HashMap<>()).put(r.getDate(), r);
        }

        List<EmployeeTally> perEmployee = new ArrayList<>();
        Map<String, Long> reasons = new LinkedHashMap<>();
        int totalPresent = 0, totalAbsent = 0;
        for (Employee e : employees) {
            Map<LocalDate, AttendanceRecord> records = index.getOrDefault(e.getId(), Map.of());
            AttendanceTally tally = new AttendanceTally(e.getId(), e.getName());
            for (LocalDate d : workingDays) {
                AttendanceRecord r = records.get(d);
                tally.add(classify(r));
                if (r != null && r.isAbsent() && StringUtils.hasText(r.getReason())) {
                    reasons.merge(r.getReason().trim(), 1L, Long::sum);
                }
            }
            EmployeeTally t = tally.toTally();
            totalPresent += t.presentDays();
            totalAbsent += t.absentDays();
            perEmployee.add(t);
        }

        List<PeriodReport.HolidayEntry> holidays = new ArrayList<>();
        for (Holiday h : span.holidays()) {
            holidays.add(new PeriodReport.HolidayEntry(h.getDate(), h.getDescription()));
        }

        List<PeriodReport.ReasonCount> topReasons = reasons.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_N)
                .map(en -> new PeriodReport.ReasonCount(en.getKey(), en.getValue()))
                .toList();

        return new PeriodReport(label, range.start(), range.end(), range.days(), workingDays.size(), holidays,
                perEmployee, totalPresent, totalAbsent,
                perEmployee.stream().sorted(BY_RATE_DESC).limit(TOP_N).toList(),
                perEmployee.stream().sorted(BY_RATE_ASC).limit(TOP_N).toList(),
                topReasons);
    }

    private static DayStatus classify(@Nullable AttendanceRecord r) {
        return DayStatus.of(r == null ? null : r.getStatus());
    }
}
