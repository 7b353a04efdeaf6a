package com.attendance.tracker.service.collection;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.constants.StreamTopics;
import com.attendance.tracker.common.exception.AttendancePersistenceException;
import com.attendance.tracker.common.exception.ConflictException;
import com.attendance.tracker.common.exception.EntityNotFoundException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.config.AttendanceProperties;
import com.attendance.tracker.core.CollectionSession;
import com.attendance.tracker.core.CollectionSessionRegistry;
import com.attendance.tracker.core.PendingRecord;
import com.attendance.tracker.core.Prompt;
import com.attendance.tracker.core.RosterEntry;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.CancelCause;
import com.attendance.tracker.enums.CollectionState;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.model.documents.Employee;
import com.attendance.tracker.model.dto.CollectionSummary;
import com.attendance.tracker.service.attendance.AttendanceRecordService;
import com.attendance.tracker.service.calendar.WorkingDayCalendar;
import com.attendance.tracker.service.employee.EmployeeService;
import com.attendance.tracker.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Drives collection sessions: one per admin, one decision per active employee,
 * written as a batch of upserts once every employee has been answered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceCollectionService {

    private final CollectionSessionRegistry registry;
    private final EmployeeService employeeService;
    private final WorkingDayCalendar calendar;
    private final AttendanceRecordService recordService;
    private final StreamGateway stream;
    private final AttendanceProperties props;
    private final Clock clock;

    /**
     * @param date null means today
     */
    public Prompt start(String adminId, @Nullable LocalDate date) {
        LocalDate day = date == null ? LocalDate.now(clock) : date;

        if (props.getCollection().isRefuseNonWorkingDays()) {
            calendar.nonWorkingReason(day).ifPresent(reason -> {
                throw new ValidationException(reason);
            });
        }

        Instant now = clock.instant();
        registry.get(adminId).ifPresent(existing -> {
            if (!existing.isStalled(now) && !existing.getState().isTerminal()) {
                throw new ConflictException("Attendance collection already in progress");
            }
        });

        List<RosterEntry> roster = new ArrayList<>();
        for (Employee e : employeeService.list(true)) {
            roster.add(new RosterEntry(e.getId(), e.getName()));
        }
        CollectionSession session = new CollectionSession(adminId, day, roster, props.getCollection().getInactivityTimeout());
        Prompt prompt = session.start(now);

        if (!registry.setIfAbsent(session, now, this::timedOut)) {
            throw new ConflictException("Attendance collection already in progress");
        }
        log.info("Attendance collection for {} started by {} ({} employees)", DateFormats.format(day), adminId, roster.size());
        stream.send(StreamTopics.SESSION_STARTED, prompt);
        return prompt;
    }

    public Prompt current(String adminId) {
        return step(adminId, session -> session.isStalled(clock.instant())
                ? session.cancel(CancelCause.TIMEOUT, clock.instant())
                : session.prompt());
    }

    public Prompt decide(String adminId, AttendanceStatus decision, @Nullable Long employeeId) {
        return step(adminId, session -> session.decide(decision, employeeId, clock.instant()));
    }

    public Prompt reason(String adminId, String reason) {
        return step(adminId, session -> session.reason(reason, clock.instant()));
    }

    public Prompt cancel(String adminId) {
        return step(adminId, session -> session.cancel(CancelCause.ADMIN, clock.instant()));
    }

    /**
     * Cancels every stalled session.
     *
     * @return number of sessions cancelled
     */
    public int sweepStalled() {
        List<CollectionSession> cancelled = registry.sweep(clock.instant());
        cancelled.forEach(this::timedOut);
        return cancelled.size();
    }

    private void timedOut(CollectionSession s) {
        log.info("Attendance collection for {} by {} timed out", DateFormats.format(s.getSessionDate()), s.getAdminId());
        stream.send(StreamTopics.SESSION_CANCELLED, s.prompt());
    }

    public int inFlight() {
        return registry.size();
    }

    private Prompt step(String adminId, Function<CollectionSession, Prompt> event) {
        CollectionSession session = registry.get(adminId)
                .orElseThrow(() -> new EntityNotFoundException("No attendance collection in progress"));
        Prompt prompt;
        synchronized (session) {
            prompt = event.apply(session);
            log.debug("Collection {} for {} -> {}", DateFormats.format(session.getSessionDate()), adminId, prompt.getState());
            if (!prompt.getState().isTerminal()) {
                return prompt;
            }
        }
        registry.remove(session);
        if (prompt.getState() == CollectionState.CANCELLED) {
            log.info("Attendance collection for {} cancelled ({})", DateFormats.format(session.getSessionDate()), prompt.getCancelCause());
            stream.send(StreamTopics.SESSION_CANCELLED, prompt);
            return prompt;
        }
        return persist(session, prompt);
    }

    private Prompt persist(CollectionSession session, Prompt prompt) {
        List<PendingRecord> batch = session.pending();
        int failures = 0;
        for (PendingRecord r : batch) {
            Result<AttendanceRecord> written = recordService.upsert(r.employeeId(), r.date(), r.status(), r.reason(),
                    RecordSource.COLLECTION);
            if (written.isFailure()) failures++;
        }
        String day = DateFormats.format(session.getSessionDate());
        if (failures > 0) {
            log.error("Attendance for {}: {} of {} records could not be saved", day, failures, batch.size());
            throw new AttendancePersistenceException(failures + " of " + batch.size()
                    + " attendance records for " + day + " could not be saved; start the collection again to retry");
        }
        log.info("Attendance for {} recorded: {} present, {} absent", day, prompt.getPresentCount(), prompt.getAbsentCount());
        stream.send(StreamTopics.ATTENDANCE_RECORDED, new CollectionSummary(session.getAdminId(), session.getSessionDate(),
                prompt.getPresentCount(), prompt.getAbsentCount()));
        return prompt.toBuilder()
                .message("Attendance for " + DateFormats.formatLong(session.getSessionDate()) + " recorded successfully!")
                .build();
    }
}
