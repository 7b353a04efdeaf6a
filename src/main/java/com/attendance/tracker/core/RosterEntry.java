package com.attendance.tracker.core;

/**
 * One employee as frozen into a collection session at start.
 */
public record RosterEntry(long employeeId, String name) {
}
