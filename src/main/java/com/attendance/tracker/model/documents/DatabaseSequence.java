package com.attendance.tracker.model.documents;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Counter document backing numeric ids.
 */
@Document("sequences")
@Data
public class DatabaseSequence {

    @Id
    private String id;

    private long seq;
}
