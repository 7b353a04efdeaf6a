package com.attendance.tracker.web;

import com.attendance.tracker.common.Result;
import com.attendance.tracker.common.exception.Http;
import com.attendance.tracker.model.dto.EmployeeRequest;
import com.attendance.tracker.service.employee.EmployeeService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {

    private final EmployeeService employees;

    @PostMapping
    public ResponseEntity<?> add(@RequestBody EmployeeRequest request) {
        return Http.from(Result.ok(employees.add(request.name())));
    }

    /**
     * Ordered by id. Inactive employees are included only with activeOnly=false.
     */
    @GetMapping
    public ResponseEntity<?> list(@RequestParam(name = "activeOnly", defaultValue = "true") boolean activeOnly) {
        return Http.from(Result.ok(employees.list(activeOnly)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable("id") long id) {
        return Http.from(Result.ok(employees.get(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> remove(@PathVariable("id") long id) {
        return Http.from(Result.ok(employees.remove(id)));
    }
}
