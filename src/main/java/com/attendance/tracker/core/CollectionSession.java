package com.attendance.tracker.core;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.CancelCause;
import com.attendance.tracker.enums.CollectionState;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finite state machine walking one administrator through every employee of a frozen roster.
 * <pre>
 * IDLE -> AWAITING_DECISION(0)
 * AWAITING_DECISION(i) --PRESENT--> AWAITING_DECISION(i+1) | COMPLETE
 * AWAITING_DECISION(i) --ABSENT---> AWAITING_REASON(i)
 * AWAITING_REASON(i)   --reason---> AWAITING_DECISION(i+1) | COMPLETE
 * any non-terminal     --cancel/timeout--> CANCELLED (pending batch discarded)
 * </pre>
 * Time is always passed in; the class has no clock and no locking. Rejected events leave the
 * session exactly as it was.
 */
public final class CollectionSession {

    private static final List<AttendanceStatus> DECISIONS = List.of(AttendanceStatus.PRESENT, AttendanceStatus.ABSENT);

    private final String adminId;
    private final LocalDate sessionDate;
    private final List<RosterEntry> roster;
    private final Duration inactivityTimeout;
    private final List<PendingRecord> pending = new ArrayList<>();

    private CollectionState state = CollectionState.IDLE;
    private int index;
    private Instant startedAt;
    private Instant lastActivityAt;
    private CancelCause cancelCause;

    public CollectionSession(String adminId, LocalDate sessionDate, List<RosterEntry> roster, Duration inactivityTimeout) {
        this.adminId = Objects.requireNonNull(adminId, "adminId");
        this.sessionDate = Objects.requireNonNull(sessionDate, "sessionDate");
        this.roster = List.copyOf(roster);
        this.inactivityTimeout = inactivityTimeout;
    }

    public Prompt start(Instant now) {
        if (state != CollectionState.IDLE) {
            throw new ValidationException("Collection already started");
        }
        if (roster.isEmpty()) {
            throw new ValidationException("No active employees");
        }
        state = CollectionState.AWAITING_DECISION;
        index = 0;
        startedAt = now;
        lastActivityAt = now;
        return prompt();
    }

    /**
     * @param employeeId the employee the caller believes it is deciding for, may be null
     */
    public Prompt decide(AttendanceStatus decision, Long employeeId, Instant now) {
        if (timedOut(now)) return prompt();
        if (state != CollectionState.AWAITING_DECISION) {
            throw new ValidationException("Not expecting a decision while " + describeState());
        }
        if (decision == null) {
            throw new ValidationException("Decision must be PRESENT or ABSENT");
        }
        RosterEntry current = roster.get(index);
        if (employeeId != null && employeeId != current.employeeId()) {
            throw new ValidationException("Decision is for employee " + employeeId
                    + " but the current employee is " + current.employeeId() + " (" + current.name() + ")");
        }
        lastActivityAt = now;
        if (decision == AttendanceStatus.ABSENT) {
            state = CollectionState.AWAITING_REASON;
            return prompt();
        }
        pending.add(new PendingRecord(current.employeeId(), current.name(), sessionDate, AttendanceStatus.PRESENT, null));
        return advance();
    }

    public Prompt reason(String text, Instant now) {
        if (timedOut(now)) return prompt();
        if (state != CollectionState.AWAITING_REASON) {
            throw new ValidationException("Not expecting a reason while " + describeState());
        }
        if (text == null || text.isBlank()) {
            throw new ValidationException("Reason for absence must not be blank");
        }
        RosterEntry current = roster.get(index);
        lastActivityAt = now;
        pending.add(new PendingRecord(current.employeeId(), current.name(), sessionDate, AttendanceStatus.ABSENT, text.trim()));
        return advance();
    }

    /**
     * Cancels a non-terminal session. Cancelling a finished session changes nothing.
     */
    public Prompt cancel(CancelCause cause, Instant now) {
        if (!state.isTerminal()) {
            state = CollectionState.CANCELLED;
            cancelCause = cause;
            lastActivityAt = now;
            pending.clear();
        }
        return prompt();
    }

    public boolean isStalled(Instant now) {
        if (state.isTerminal() || lastActivityAt == null || inactivityTimeout == null) return false;
        return !now.isBefore(lastActivityAt.plus(inactivityTimeout));
    }

    public Prompt prompt() {
        Prompt.PromptBuilder b = Prompt.builder()
                .state(state)
                .sessionDate(sessionDate)
                .total(roster.size());
        switch (state) {
            case IDLE -> b.message("Attendance for " + DateFormats.formatLong(sessionDate) + " not started");
            case AWAITING_DECISION -> {
                RosterEntry e = roster.get(index);
                b.employeeId(e.employeeId()).employeeName(e.name()).position(index + 1).choices(DECISIONS)
                        .message("Employee #" + (index + 1) + ": " + e.name() + "\nDate: " + DateFormats.formatLong(sessionDate));
            }
            case AWAITING_REASON -> {
                RosterEntry e = roster.get(index);
                b.employeeId(e.employeeId()).employeeName(e.name()).position(index + 1)
                        .message("Reason for absence of " + e.name() + ":");
            }
            case COMPLETE -> b.presentCount(count(AttendanceStatus.PRESENT)).absentCount(count(AttendanceStatus.ABSENT))
                    .message("Attendance for " + DateFormats.formatLong(sessionDate) + " collected");
            case CANCELLED -> b.cancelCause(cancelCause).message(cancelCause == CancelCause.TIMEOUT
                    ? "Attendance collection for " + DateFormats.formatLong(sessionDate) + " timed out; nothing was recorded"
                    : "Attendance collection for " + DateFormats.formatLong(sessionDate) + " cancelled; nothing was recorded");
        }
        return b.build();
    }

    private Prompt advance() {
        if (index + 1 >= roster.size()) {
            state = CollectionState.COMPLETE;
        } else {
            index++;
            state = CollectionState.AWAITING_DECISION;
        }
        return prompt();
    }

    private boolean timedOut(Instant now) {
        if (isStalled(now)) {
            cancel(CancelCause.TIMEOUT, now);
            return true;
        }
        return false;
    }

    private int count(AttendanceStatus status) {
        int n = 0;
        for (PendingRecord r : pending) {
            if (r.status() == status) n++;
        }
        return n;
    }

    private String describeState() {
        return switch (state) {
            case IDLE -> "the collection has not started";
            case AWAITING_DECISION -> "awaiting a decision for " + roster.get(index).name();
            case AWAITING_REASON -> "awaiting an absence reason for " + roster.get(index).name();
            case COMPLETE -> "the collection is complete";
            case CANCELLED -> "the collection is cancelled";
        };
    }

    public List<PendingRecord> pending() {
        return Collections.unmodifiableList(pending);
    }

    public String getAdminId() {
        return adminId;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public CollectionState getState() {
        return state;
    }

    public int getIndex() {
        return index;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public CancelCause getCancelCause() {
        return cancelCause;
    }
}
