package com.deepansh.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a single {@link DatabaseTools} invocation.
 *
 * @param status    ok | error
 * @param count     number of documents returned or affected (0 on error)
 * @param data      returned documents, empty on error or for writes
 * @param error     error description, null when status is ok
 * @param latencyMs wall-clock time spent in the store
 */
public record QueryResult(Status status,
                          int count,
                          List<Map<String, Object>> data,
                          String error,
                          double latencyMs) {

    public enum Status {
        OK("ok"), ERROR("error");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public QueryResult {
        data = data != null ? List.copyOf(data) : List.of();
    }

    public static QueryResult ok(List<Map<String, Object>> data, double latencyMs) {
        return new QueryResult(Status.OK, data.size(), data, null, latencyMs);
    }

    public static QueryResult written(int count, double latencyMs) {
        return new QueryResult(Status.OK, count, List.of(), null, latencyMs);
    }

    public static QueryResult error(String error, double latencyMs) {
        return new QueryResult(Status.ERROR, 0, List.of(), error, latencyMs);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
