package com.attendance.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Externalized knobs under {@code attendance.*}.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProperties {

    /** Zone used to decide what "today" is. */
    private ZoneId zone = ZoneId.of("Asia/Kolkata");

    private Admin admin = new Admin();
    private Collection collection = new Collection();
    private Absence absence = new Absence();
    private Calendar calendar = new Calendar();

    @Data
    public static class Admin {
        /** The only identity allowed to call the API (X-Admin-Id). */
        private String id;
    }

    @Data
    public static class Collection {
        private Duration inactivityTimeout = Duration.ofMinutes(10);
        private long sweepIntervalMs = 30_000L;
        /** Refuse to start a collection on a holiday or weekly off day. */
        private boolean refuseNonWorkingDays = false;
    }

    @Data
    public static class Absence {
        /** When true, holidays and weekly off days inside the range are not written. */
        private boolean skipNonWorkingDays = false;
        private int maxDays = 366;
        private String defaultReason = "Not specified";
    }

    @Data
    public static class Calendar {
        /** Days of week that are never working days, e.g. SUNDAY. Empty by default. */
        private Set<DayOfWeek> weeklyOffDays = EnumSet.noneOf(DayOfWeek.class);
    }
}
