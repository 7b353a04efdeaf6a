package com.attendance.tracker.web;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.exception.Http;
import com.attendance.tracker.model.dto.AbsenceRequest;
import com.attendance.tracker.model.dto.DecisionRequest;
import com.attendance.tracker.model.dto.ReasonRequest;
import com.attendance.tracker.model.dto.StartCollectionRequest;
import com.attendance.tracker.service.attendance.AbsenceService;
import com.attendance.tracker.service.collection.AttendanceCollectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

import static com.attendance.tracker.web.AdminIdentityInterceptor.ADMIN_HEADER;

/**
 * Conversational attendance collection plus the multi-day absence shortcut.
 * Each collection step answers with the next prompt.
 */
@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {

    private final AttendanceCollectionService collection;
    private final AbsenceService absences;

    @PostMapping("/sessions")
    public ResponseEntity<?> start(@RequestHeader(ADMIN_HEADER) String adminId,
                                   @RequestBody(required = false) StartCollectionRequest request) {
        LocalDate date = request != null && StringUtils.hasText(request.date()) ? DateFormats.parse(request.date()) : null;
        return Http.from(Result.ok(collection.start(adminId.trim(), date)));
    }

    @GetMapping("/sessions/current")
    public ResponseEntity<?> current(@RequestHeader(ADMIN_HEADER) String adminId) {
        return Http.from(Result.ok(collection.current(adminId.trim())));
    }

    @PostMapping("/sessions/current/decision")
    public ResponseEntity<?> decide(@RequestHeader(ADMIN_HEADER) String adminId,
                                    @Valid @RequestBody DecisionRequest request) {
        return Http.from(Result.ok(collection.decide(adminId.trim(), request.decision(), request.employeeId())));
    }

    @PostMapping("/sessions/current/reason")
    public ResponseEntity<?> reason(@RequestHeader(ADMIN_HEADER) String adminId,
                                    @RequestBody ReasonRequest request) {
        return Http.from(Result.ok(collection.reason(adminId.trim(), request.reason())));
    }

    @DeleteMapping("/sessions/current")
    public ResponseEntity<?> cancel(@RequestHeader(ADMIN_HEADER) String adminId) {
        return Http.from(Result.ok(collection.cancel(adminId.trim())));
    }

    @PostMapping("/absences")
    public ResponseEntity<?> absence(@Valid @RequestBody AbsenceRequest request) {
        LocalDate start = DateFormats.parse(request.startDate(), "start date");
        LocalDate end = DateFormats.parse(request.endDate(), "end date");
        return Http.from(Result.ok(absences.recordAbsence(request.employeeId(), start, end, request.reason())));
    }
}
