package com.attendance.tracker.service.collection;

import com.attendance.tracker.service.employee.EmployeeService;
import com.attendance.tracker.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CollectionHealthIndicator implements HealthIndicator {

    private final AttendanceCollectionService collectionService;
    private final EmployeeService employeeService;
    private final StreamGateway stream;

    @Override
    public Health health() {
        try {
            long active = employeeService.countActive();
            return Health.up()
                    .withDetail("active_employees", active)
                    .withDetail("sessions_in_flight", collectionService.inFlight())
                    .withDetail("sse_subscribers", stream.subscriberCount())
                    .withDetail("status", "Employee repository accessible")
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("status", "Employee repository not accessible")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
