package com.deepansh.orchestrator.tool;

import java.util.List;
import java.util.Map;

/**
 * Document-store operations available to the executor and to persistence.
 *
 * Implementations should not throw for store-side failures: they return a
 * {@link QueryResult} with error status instead, so callers can record the
 * failure and carry on.
 */
public interface DatabaseTools {

    String FIND = "db.find";
    String INSERT = "db.insert";
    String AGGREGATE = "db.aggregate";

    /** Documents of {@code collection} matching {@code filter}, at most {@code limit}. */
    QueryResult find(String collection, Map<String, Object> filter, int limit);

    /** Inserts one document; count is 1 on success. */
    QueryResult insert(String collection, Map<String, Object> document);

    /** Runs an aggregation pipeline (list of stage documents). */
    QueryResult aggregate(String collection, List<Map<String, Object>> pipeline);
}
