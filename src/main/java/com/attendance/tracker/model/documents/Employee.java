package com.attendance.tracker.model.documents;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document("employees")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Employee {

    public static final String SEQUENCE = "employees";

    @Id
    private Long id;

    private String name;

    @Indexed
    private boolean active;

    private Instant createdAt;

    private Instant deactivatedAt;
}
