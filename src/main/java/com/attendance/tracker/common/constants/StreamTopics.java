package com.attendance.tracker.common.constants;

/**
 * SSE topic names published through the stream gateway.
 */
public final class StreamTopics {

    public static final String ATTENDANCE_RECORDED = "attendance.recorded";
    public static final String ABSENCE_RECORDED = "attendance.absence.recorded";
    public static final String SESSION_STARTED = "attendance.session.started";
    public static final String SESSION_CANCELLED = "attendance.session.cancelled";
    public static final String HOLIDAY_ADDED = "holiday.added";
    public static final String HOLIDAY_REMOVED = "holiday.removed";
    public static final String EMPLOYEE_CHANGED = "employee.changed";

    private StreamTopics() {
    }
}
