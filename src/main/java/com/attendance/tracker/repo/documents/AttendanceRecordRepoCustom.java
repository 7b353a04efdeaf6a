package com.attendance.tracker.repo.documents;

import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;

import java.time.LocalDate;

public interface AttendanceRecordRepoCustom {

    /**
     * Inserts or overwrites the record for (employeeId, date). The reason is dropped for PRESENT.
     *
     * @return the stored record
     */
    AttendanceRecord upsert(Long employeeId, LocalDate date, AttendanceStatus status, String reason, RecordSource source);
}
