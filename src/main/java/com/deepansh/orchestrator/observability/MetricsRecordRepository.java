package com.deepansh.orchestrator.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MetricsRecordRepository extends MongoRepository<MetricsRecord, String> {

    @Aggregation(pipeline = {
        "{ $group: { _id: null, avg: { $avg: '$totalMs' } } }"
    })
    Double avgTotalMs();
}
