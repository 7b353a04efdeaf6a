package com.attendance.tracker.repo.documents;

import com.attendance.tracker.model.documents.Employee;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeRepo extends MongoRepository<Employee, Long> {

    List<Employee> findAllByOrderByIdAsc();

    List<Employee> findByActiveTrueOrderByIdAsc();

    long countByActiveTrue();
}
