package com.attendance.tracker.model.documents;

import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.RecordSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One employee on one day. At most one document exists per (employeeId, date).
 */
@Document("attendance_records")
@CompoundIndex(name = "uniq_employee_date", def = "{'employeeId': 1, 'date': 1}", unique = true)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecord {

    @Id
    private String id;

    private Long employeeId;

    @Indexed
    private LocalDate date;

    private AttendanceStatus status;

    /** Only set for ABSENT. */
    private String reason;

    private RecordSource source;

    private Instant updatedAt;

    public boolean isAbsent() {
        return status == AttendanceStatus.ABSENT;
    }
}
