package com.attendance.tracker.repo.documents;

import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.model.documents.AttendanceRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Attendance records keyed by (employeeId, date). Writes go through
 * {@link AttendanceRecordRepoCustom#upsert} so a second write for the same key overwrites.
 */
@Repository
public interface AttendanceRecordRepo extends MongoRepository<AttendanceRecord, String>, AttendanceRecordRepoCustom {

    Optional<AttendanceRecord> findByEmployeeIdAndDate(Long employeeId, LocalDate date);

    List<AttendanceRecord> findByDate(LocalDate date);

    // Inclusive on both ends; derived Between is exclusive for dates in Spring Data Mongo
    @Query("{'date': {$gte: ?0, $lte: ?1}}")
    List<AttendanceRecord> findByDateBetween(LocalDate from, LocalDate to);

    @Query("{'employeeId': ?0, 'date': {$gte: ?1, $lte: ?2}}")
    List<AttendanceRecord> findByEmployeeIdAndDateBetween(Long employeeId, LocalDate from, LocalDate to);

    List<AttendanceRecord> findTop3ByEmployeeIdAndStatusOrderByDateDesc(Long employeeId, AttendanceStatus status);
}
