package com.attendance.tracker.web;

import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.exception.Http;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Help listing of everything the administrator can do.
 */
@RestController
@RequestMapping("/api")
public class CommandsController {

    public record Command(String name, String method, String path, String description) {
    }

    static final List<Command> COMMANDS = List.of(
            new Command("add_employee", "POST", "/api/employees", "Add a new employee {name}"),
            new Command("list_employees", "GET", "/api/employees?activeOnly=true", "List employees by id"),
            new Command("remove_employee", "DELETE", "/api/employees/{id}", "Deactivate an employee, history is kept"),
            new Command("mark_attendance", "POST", "/api/attendance/sessions", "Start collecting attendance {date?}"),
            new Command("current_prompt", "GET", "/api/attendance/sessions/current", "Show the current collection prompt"),
            new Command("decide", "POST", "/api/attendance/sessions/current/decision", "Answer PRESENT or ABSENT {decision, employeeId?}"),
            new Command("reason", "POST", "/api/attendance/sessions/current/reason", "Give the absence reason {reason}"),
            new Command("cancel", "DELETE", "/api/attendance/sessions/current", "Abandon the collection, nothing is saved"),
            new Command("multiday_absence", "POST", "/api/attendance/absences", "Mark absent over a range {employeeId, startDate, endDate, reason?}"),
            new Command("daily_report", "GET", "/api/reports/daily", "Today's attendance"),
            new Command("date_report", "GET", "/api/reports/date/{DD-MM-YYYY}", "Attendance on a given date"),
            new Command("last_7_days", "GET", "/api/reports/last-7-days", "Summary of the last 7 days"),
            new Command("last_30_days", "GET", "/api/reports/last-30-days", "Summary of the last 30 days"),
            new Command("monthly_report", "GET", "/api/reports/monthly?month=MM-YYYY", "Summary of a calendar month"),
            new Command("period_report", "GET", "/api/reports/period?start=DD-MM-YYYY&end=DD-MM-YYYY", "Summary of any date range"),
            new Command("employee_report", "GET", "/api/reports/employees/{id}", "One employee's history and trend"),
            new Command("mark_holiday", "POST", "/api/holidays", "Mark a holiday {date?, description}"),
            new Command("list_holidays", "GET", "/api/holidays", "List holidays by date"),
            new Command("remove_holiday", "DELETE", "/api/holidays/{DD-MM-YYYY}", "Remove a holiday"),
            new Command("stream", "GET", "/api/stream?topics=attendance.*", "Server-sent notifications")
    );

    @GetMapping("/commands")
    public ResponseEntity<?> commands() {
        return Http.from(Result.ok(COMMANDS));
    }
}
