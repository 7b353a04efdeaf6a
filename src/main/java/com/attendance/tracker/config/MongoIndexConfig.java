package com.attendance.tracker.config;

import com.attendance.tracker.model.documents.AttendanceRecord;
import com.attendance.tracker.model.documents.Holiday;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * Ensures the uniqueness constraints the upsert logic relies on, whether or not
 * Spring Data auto index creation is switched on.
 * <p>
 * Toggle with attendance.mongo.ensure-indexes=false
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "attendance.mongo", name = "ensure-indexes", havingValue = "true", matchIfMissing = true)
public class MongoIndexConfig {

    @Bean
    public ApplicationRunner mongoIndexBootstrap(MongoTemplate mongoTemplate) {
        return args -> {
            try {
                mongoTemplate.indexOps(AttendanceRecord.class).ensureIndex(new Index()
                        .on("employeeId", Sort.Direction.ASC)
                        .on("date", Sort.Direction.ASC)
                        .unique()
                        .named("uniq_employee_date"));
                mongoTemplate.indexOps(Holiday.class).ensureIndex(new Index()
                        .on("date", Sort.Direction.ASC)
                        .unique()
                        .named("date"));
                log.info("Mongo indexes ensured for attendance_records and holidays");
            } catch (Exception e) {
                log.warn("Failed to ensure Mongo indexes: {}", e.getMessage());
            }
        };
    }
}
