package com.attendance.tracker.service.employee;

import com.attendance.tracker.common.constants.StreamTopics;
import com.attendance.tracker.common.exception.EntityNotFoundException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.model.documents.Employee;
import com.attendance.tracker.repo.documents.EmployeeRepo;
import com.attendance.tracker.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Owns the employee lifecycle. Employees are never hard-deleted so their
 * attendance history keeps resolving to a name.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepo employeeRepo;
    private final SequenceGenerator sequenceGenerator;
    private final StreamGateway stream;
    private final Clock clock;

    public Employee add(String name) {
        if (!StringUtils.hasText(name)) {
            throw new ValidationException("Employee name must not be blank");
        }
        Employee employee = Employee.builder()
                .id(sequenceGenerator.next(Employee.SEQUENCE))
                .name(name.trim())
                .active(true)
                .createdAt(Instant.now(clock))
                .build();
        Employee saved = employeeRepo.save(employee);
        log.info("Added employee {} (id={})", saved.getName(), saved.getId());
        publish(saved);
        return saved;
    }

    /**
     * Ordered by id ascending.
     */
    public List<Employee> list(boolean activeOnly) {
        return activeOnly ? employeeRepo.findByActiveTrueOrderByIdAsc() : employeeRepo.findAllByOrderByIdAsc();
    }

    public Employee get(long id) {
        return employeeRepo.findById(id).orElseThrow(() -> new EntityNotFoundException("Employee", id));
    }

    /**
     * Active employee or NotFound.
     */
    public Employee getActive(long id) {
        Employee employee = get(id);
        if (!employee.isActive()) {
            throw new EntityNotFoundException("Employee with ID " + id + " not found or inactive");
        }
        return employee;
    }

    /**
     * Soft delete. Removing an already inactive employee is a no-op.
     */
    public Employee remove(long id) {
        Employee employee = get(id);
        if (!employee.isActive()) {
            log.debug("Employee {} already inactive", id);
            return employee;
        }
        employee.setActive(false);
        employee.setDeactivatedAt(Instant.now(clock));
        Employee saved = employeeRepo.save(employee);
        log.info("Removed employee {} (id={})", saved.getName(), saved.getId());
        publish(saved);
        return saved;
    }

    public long countActive() {
        return employeeRepo.countByActiveTrue();
    }

    private void publish(Employee employee) {
        stream.send(StreamTopics.EMPLOYEE_CHANGED, employee);
    }
}
