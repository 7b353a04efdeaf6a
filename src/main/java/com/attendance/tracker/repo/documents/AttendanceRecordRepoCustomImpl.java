package com.attendance.tracker.repo.documents;

import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.LocalDate;

@RequiredArgsConstructor
public class AttendanceRecordRepoCustomImpl implements AttendanceRecordRepoCustom {

    private static final String F_EMPLOYEE_ID = "employeeId";
    private static final String F_DATE = "date";

    private final MongoTemplate mongoTemplate;

    @Override
    public AttendanceRecord upsert(Long employeeId, LocalDate date, AttendanceStatus status, String reason, RecordSource source) {
        Query q = new Query(Criteria.where(F_EMPLOYEE_ID).is(employeeId).and(F_DATE).is(date));
        Update u = new Update()
                .set("status", status)
                .set("reason", status == AttendanceStatus.ABSENT ? reason : null)
                .set("source", source)
                .set("updatedAt", Instant.now());
        return mongoTemplate.findAndModify(q, u,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                AttendanceRecord.class);
    }
}
