package com.attendance.tracker.service.employee;

import com.attendance.tracker.model.documents.DatabaseSequence;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * Monotonic numeric ids backed by the {@code sequences} collection.
 */
@Component
@RequiredArgsConstructor
public class SequenceGenerator {

    private final MongoTemplate mongoTemplate;

    public long next(String sequenceName) {
        DatabaseSequence counter = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(sequenceName)),
                new Update().inc("seq", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                DatabaseSequence.class);
        return counter == null ? 1L : counter.getSeq();
    }
}
