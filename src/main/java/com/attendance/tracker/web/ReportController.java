package com.attendance.tracker.web;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.exception.Http;
import com.attendance.tracker.service.report.ReportPeriod;
import com.attendance.tracker.service.report.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Read-only reports. All dates are DD-MM-YYYY, months MM-YYYY.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reports;

    @GetMapping("/daily")
    public ResponseEntity<?> daily() {
        return Http.from(Result.ok(reports.dailyReport(reports.today())));
    }

    @GetMapping("/date/{date}")
    public ResponseEntity<?> date(@PathVariable("date") String date) {
        return Http.from(Result.ok(reports.dailyReport(DateFormats.parse(date))));
    }

    @GetMapping("/last-7-days")
    public ResponseEntity<?> last7Days() {
        return Http.from(Result.ok(reports.periodReport(ReportPeriod.LAST_7_DAYS)));
    }

    @GetMapping("/last-30-days")
    public ResponseEntity<?> last30Days() {
        return Http.from(Result.ok(reports.periodReport(ReportPeriod.LAST_30_DAYS)));
    }

    /**
     * Defaults to the current month.
     */
    @GetMapping("/monthly")
    public ResponseEntity<?> monthly(@RequestParam(name = "month", required = false) String month) {
        return Http.from(Result.ok(reports.monthlyReport(StringUtils.hasText(month) ? DateFormats.parseMonth(month) : null)));
    }

    @GetMapping("/period")
    public ResponseEntity<?> period(@RequestParam("start") String start, @RequestParam("end") String end) {
        return Http.from(Result.ok(reports.periodReport(
                DateFormats.parse(start, "start date"), DateFormats.parse(end, "end date"))));
    }

    /**
     * Defaults to the 30 days ending today.
     */
    @GetMapping("/employees/{id}")
    public ResponseEntity<?> employee(@PathVariable("id") long id,
                                      @RequestParam(name = "start", required = false) String start,
                                      @RequestParam(name = "end", required = false) String end) {
        LocalDate from = StringUtils.hasText(start) ? DateFormats.parse(start, "start date") : null;
        LocalDate to = StringUtils.hasText(end) ? DateFormats.parse(end, "end date") : null;
        return Http.from(Result.ok(reports.employeeReport(id, from, to)));
    }
}
