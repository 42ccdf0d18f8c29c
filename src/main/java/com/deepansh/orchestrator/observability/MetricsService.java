package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.exception.PersistenceException;
import com.deepansh.orchestrator.memory.MessageRecordRepository;
import com.deepansh.orchestrator.memory.SessionRecordRepository;
import com.deepansh.orchestrator.model.MetricsResponse;
import com.deepansh.orchestrator.model.VitalsResponse;
import com.deepansh.orchestrator.tool.DatabaseTools;
import com.deepansh.orchestrator.tool.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-side analytics over the metrics, sessions, messages and tool_calls collections.
 */
@Service
@Slf4j
public class MetricsService {

    private static final String METRICS_COLLECTION = "metrics";

    private final DatabaseTools databaseTools;
    private final MetricsRecordRepository metricsRepository;
    private final SessionRecordRepository sessionRepository;
    private final MessageRecordRepository messageRepository;
    private final ToolCallRecordRepository toolCallRepository;
    private final Clock clock;
    private final Instant startedAt;

    public MetricsService(DatabaseTools databaseTools,
                          MetricsRecordRepository metricsRepository,
                          SessionRecordRepository sessionRepository,
                          MessageRecordRepository messageRepository,
                          ToolCallRecordRepository toolCallRepository,
                          Clock clock) {
        this.databaseTools = databaseTools;
        this.metricsRepository = metricsRepository;
        this.sessionRepository = sessionRepository;
        this.messageRepository = messageRepository;
        this.toolCallRepository = toolCallRepository;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public MetricsResponse sessionMetrics(String sessionId) {
        List<Map<String, Object>> pipeline = List.of(
                Map.of("$match", Map.of("sessionId", sessionId)),
                Map.of("$group", Map.of(
                        "_id", "$sessionId",
                        "totalRequests", Map.of("$sum", 1),
                        "avgTtftMs", Map.of("$avg", "$ttftMs"),
                        "avgTotalMs", Map.of("$avg", "$totalMs"),
                        "totalToolCalls", Map.of("$sum", "$toolCallCount"))));

        QueryResult result = databaseTools.aggregate(METRICS_COLLECTION, pipeline);
        if (!result.isOk()) {
            throw new PersistenceException("Metrics aggregation failed: " + result.error());
        }

        if (result.data().isEmpty()) {
            return MetricsResponse.builder().sessionId(sessionId).build();
        }

        Map<String, Object> row = result.data().get(0);
        Number avgTtft = (Number) row.get("avgTtftMs");
        log.debug("{} metrics [sessionId={}, row={}]", DatabaseTools.AGGREGATE, sessionId, row);

        return MetricsResponse.builder()
                .sessionId(sessionId)
                .totalRequests(asLong(row.get("totalRequests")))
                .avgTtftMs(avgTtft != null ? round(avgTtft.doubleValue()) : null)
                .avgTotalMs(round(asDouble(row.get("avgTotalMs"))))
                .totalToolCalls(asLong(row.get("totalToolCalls")))
                .build();
    }

    public VitalsResponse vitals() {
        Double avg = metricsRepository.avgTotalMs();
        return VitalsResponse.builder()
                .uptimeSeconds(Duration.between(startedAt, clock.instant()).toSeconds())
                .totalSessions(sessionRepository.count())
                .totalMessages(messageRepository.count())
                .totalToolCalls(toolCallRepository.count())
                .avgResponseTimeMs(avg != null ? round(avg) : 0.0)
                .build();
    }

    private static long asLong(Object v) {
        return v instanceof Number n ? n.longValue() : 0L;
    }

    private static double asDouble(Object v) {
        return v instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
