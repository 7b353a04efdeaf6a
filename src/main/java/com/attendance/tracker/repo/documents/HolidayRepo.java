package com.attendance.tracker.repo.documents;

import com.attendance.tracker.model.documents.Holiday;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface HolidayRepo extends MongoRepository<Holiday, String> {

    Optional<Holiday> findByDate(LocalDate date);

    boolean existsByDate(LocalDate date);

    long deleteByDate(LocalDate date);

    List<Holiday> findAllByOrderByDateAsc();

    // Both bounds inclusive
    @Query(value = "{'date': {$gte: ?0, $lte: ?1}}", sort = "{'date': 1}")
    List<Holiday> findInRange(LocalDate from, LocalDate to);
}
