package com.attendance.tracker.test.core;

import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.core.CollectionSession;
import com.attendance.tracker.core.PendingRecord;
import com.attendance.tracker.core.Prompt;
import com.attendance.tracker.core.RosterEntry;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.CancelCause;
import com.attendance.tracker.enums.CollectionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionSessionTest {

    static final LocalDate DAY = LocalDate.of(2025, 7, 15);
    static final Instant T0 = Instant.parse("2025-07-15T04:00:00Z");
    static final Duration TIMEOUT = Duration.ofMinutes(10);

    CollectionSession session;

    @BeforeEach
    void setUp() {
        session = new CollectionSession("admin", DAY, List.of(
                new RosterEntry(1, "Asha"),
                new RosterEntry(2, "Ravi"),
                new RosterEntry(3, "Meena")), TIMEOUT);
    }

    @Test
    void startAsksForFirstEmployee() {
        Prompt p = session.start(T0);

        assertThat(p.getState()).isEqualTo(CollectionState.AWAITING_DECISION);
        assertThat(p.getEmployeeId()).isEqualTo(1L);
        assertThat(p.getEmployeeName()).isEqualTo("Asha");
        assertThat(p.getPosition()).isEqualTo(1);
        assertThat(p.getTotal()).isEqualTo(3);
        assertThat(p.getChoices()).containsExactly(AttendanceStatus.PRESENT, AttendanceStatus.ABSENT);
        assertThat(p.getSessionDate()).isEqualTo(DAY);
        assertThat(p.getMessage()).contains("Employee #1: Asha").contains("15-Jul-2025");
    }

    @Test
    void everyEmployeeAnsweredCompletesWithOneRecordEach() {
        session.start(T0);
        session.decide(AttendanceStatus.PRESENT, 1L, T0.plusSeconds(5));
        Prompt reasonPrompt = session.decide(AttendanceStatus.ABSENT, 2L, T0.plusSeconds(10));
        assertThat(reasonPrompt.getState()).isEqualTo(CollectionState.AWAITING_REASON);
        assertThat(reasonPrompt.getChoices()).isEmpty();

        session.reason("  Sick  ", T0.plusSeconds(20));
        Prompt done = session.decide(AttendanceStatus.PRESENT, null, T0.plusSeconds(30));

        assertThat(done.getState()).isEqualTo(CollectionState.COMPLETE);
        assertThat(done.getPresentCount()).isEqualTo(2);
        assertThat(done.getAbsentCount()).isEqualTo(1);
        assertThat(session.pending()).hasSize(3)
                .extracting(PendingRecord::date).containsOnly(DAY);
        assertThat(session.pending()).extracting(PendingRecord::employeeId).containsExactly(1L, 2L, 3L);
        assertThat(session.pending().get(1).reason()).isEqualTo("Sick");
        assertThat(session.pending().get(0).reason()).isNull();
    }

    @Test
    void emptyRosterCannotStart() {
        CollectionSession empty = new CollectionSession("admin", DAY, List.of(), TIMEOUT);

        assertThatThrownBy(() -> empty.start(T0))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No active employees");
        assertThat(empty.getState()).isEqualTo(CollectionState.IDLE);
    }

    @Test
    void staleEmployeeIdIsRejectedWithoutChangingState() {
        session.start(T0);

        assertThatThrownBy(() -> session.decide(AttendanceStatus.PRESENT, 2L, T0.plusSeconds(1)))
                .isInstanceOf(ValidationException.class);

        assertThat(session.getState()).isEqualTo(CollectionState.AWAITING_DECISION);
        assertThat(session.getIndex()).isZero();
        assertThat(session.pending()).isEmpty();
    }

    @Test
    void eventsOutOfStepAreRejected() {
        session.start(T0);
        assertThatThrownBy(() -> session.reason("Sick", T0.plusSeconds(1)))
                .isInstanceOf(ValidationException.class);

        session.decide(AttendanceStatus.ABSENT, 1L, T0.plusSeconds(2));
        assertThatThrownBy(() -> session.decide(AttendanceStatus.PRESENT, 1L, T0.plusSeconds(3)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> session.reason("   ", T0.plusSeconds(4)))
                .isInstanceOf(ValidationException.class);

        assertThat(session.getState()).isEqualTo(CollectionState.AWAITING_REASON);
    }

    @Test
    void cancelDiscardsPendingBatch() {
        session.start(T0);
        session.decide(AttendanceStatus.PRESENT, 1L, T0.plusSeconds(1));

        Prompt p = session.cancel(CancelCause.ADMIN, T0.plusSeconds(2));

        assertThat(p.getState()).isEqualTo(CollectionState.CANCELLED);
        assertThat(p.getCancelCause()).isEqualTo(CancelCause.ADMIN);
        assertThat(session.pending()).isEmpty();
    }

    @Test
    void eventAfterInactivityTimeoutCancelsInsteadOfApplying() {
        session.start(T0);
        session.decide(AttendanceStatus.PRESENT, 1L, T0.plusSeconds(60));

        assertThat(session.isStalled(T0.plusSeconds(60).plus(TIMEOUT).minusSeconds(1))).isFalse();
        Prompt p = session.decide(AttendanceStatus.PRESENT, 2L, T0.plusSeconds(60).plus(TIMEOUT));

        assertThat(p.getState()).isEqualTo(CollectionState.CANCELLED);
        assertThat(p.getCancelCause()).isEqualTo(CancelCause.TIMEOUT);
        assertThat(session.pending()).isEmpty();
    }

    @Test
    void finishedSessionIgnoresCancelAndRejectsEvents() {
        CollectionSession single = new CollectionSession("admin", DAY, List.of(new RosterEntry(7, "Zoya")), TIMEOUT);
        single.start(T0);
        single.decide(AttendanceStatus.PRESENT, 7L, T0);

        assertThat(single.cancel(CancelCause.ADMIN, T0).getState()).isEqualTo(CollectionState.COMPLETE);
        assertThat(single.pending()).hasSize(1);
        assertThatThrownBy(() -> single.decide(AttendanceStatus.PRESENT, null, T0))
                .isInstanceOf(ValidationException.class);
        assertThat(single.isStalled(T0.plus(Duration.ofHours(1)))).isFalse();
    }
}
