package com.attendance.tracker.service.attendance;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.Result;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.repo.documents.AttendanceRecordRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * The single write path for attendance records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceRecordService {

    private final AttendanceRecordRepo recordRepo;

    /**
     * Upserts one record keyed by (employeeId, date). Never throws; a failed write comes back
     * as a failed Result so a batch can carry on with the remaining records.
     */
    public Result<AttendanceRecord> upsert(long employeeId, LocalDate date, AttendanceStatus status,
                                           String reason, RecordSource source) {
        try {
            AttendanceRecord saved = recordRepo.upsert(employeeId, date, status, reason, source);
            log.debug("Upserted {} for employee {} on {}", status, employeeId, DateFormats.format(date));
            return Result.ok(saved);
        } catch (Exception e) {
            log.warn("Failed to write attendance for employee {} on {}: {}", employeeId, DateFormats.format(date), e.getMessage());
            return Result.fail("ERR-DB-002", e.getMessage());
        }
    }
}
