package com.attendance.tracker.web;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.exception.Http;
import com.attendance.tracker.model.documents.Holiday;
import com.attendance.tracker.model.dto.HolidayRequest;
import com.attendance.tracker.model.dto.PeriodReport;
import com.attendance.tracker.service.calendar.HolidayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/holidays")
@RequiredArgsConstructor
public class HolidayController {

    private final HolidayService holidays;

    /**
     * Marks a holiday; without a date, today.
     */
    @PostMapping
    public ResponseEntity<?> add(@RequestBody HolidayRequest request) {
        LocalDate date = StringUtils.hasText(request.date()) ? DateFormats.parse(request.date()) : null;
        return Http.from(Result.ok(toEntry(holidays.add(date, request.description()))));
    }

    @GetMapping
    public ResponseEntity<?> list() {
        List<PeriodReport.HolidayEntry> out = holidays.list().stream().map(HolidayController::toEntry).toList();
        return Http.from(Result.ok(out));
    }

    @DeleteMapping("/{date}")
    public ResponseEntity<?> remove(@PathVariable("date") String date) {
        LocalDate day = DateFormats.parse(date);
        holidays.remove(day);
        return Http.from(Result.ok(new PeriodReport.HolidayEntry(day, null)));
    }

    private static PeriodReport.HolidayEntry toEntry(Holiday h) {
        return new PeriodReport.HolidayEntry(h.getDate(), h.getDescription());
    }
}
