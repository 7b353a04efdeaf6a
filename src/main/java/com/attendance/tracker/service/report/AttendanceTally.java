package com.attendance.tracker.service.report;

import com.attendance.tracker.enums.DayStatus;
import com.attendance.tracker.model.dto.EmployeeTally;

/**
 * Mutable counter for one employee while a report is being built.
 */
public final class AttendanceTally {

    private final long employeeId;
    private final String name;
    private int present;
    private int absent;
    private int unmarked;

    public AttendanceTally(long employeeId, String name) {
        this.employeeId = employeeId;
        this.name = name;
    }

    public void add(DayStatus status) {
        switch (status) {
            case PRESENT -> present++;
            case ABSENT -> absent++;
            case UNMARKED -> unmarked++;
            case NON_WORKING -> throw new IllegalArgumentException("Non-working days are not tallied");
        }
    }

    /**
     * round(100 * present / (present + absent)), 0 when nothing is marked.
     */
    public static int rate(int present, int absent) {
        int marked = present + absent;
        return marked == 0 ? 0 : (int) Math.round(100.0 * present / marked);
    }

    public EmployeeTally toTally() {
        return new EmployeeTally(employeeId, name, present, absent, unmarked, rate(present, absent));
    }
}
