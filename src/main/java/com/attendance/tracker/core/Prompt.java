package com.attendance.tracker.core;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.CancelCause;
import com.attendance.tracker.enums.CollectionState;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * What the administrator sees after each collection step: a message and the allowed choices.
 * An empty choice list while awaiting a reason means free text is expected.
 */
@Value
@Builder(toBuilder = true)
public class Prompt {

    CollectionState state;
    String message;
    @Builder.Default
    List<AttendanceStatus> choices = List.of();
    Long employeeId;
    String employeeName;
    /** 1-based */
    Integer position;
    Integer total;
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DateFormats.PATTERN)
    LocalDate sessionDate;
    CancelCause cancelCause;
    Integer presentCount;
    Integer absentCount;
}
