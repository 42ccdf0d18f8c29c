package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.Finding;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.Stage;
import com.deepansh.orchestrator.core.ToolCallLog;
import com.deepansh.orchestrator.tool.DatabaseTools;
import com.deepansh.orchestrator.tool.QueryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the planned subtasks.
 *
 * A subtask that mentions data access issues exactly one bounded db.find
 * for the session's messages; everything else is marked completed. Query
 * failures become failed findings, never exceptions. Findings and tool
 * calls are appended to what earlier passes produced.
 */
@Component
@Slf4j
public class ExecutorAgent extends AbstractStageAgent {

    private final DatabaseTools databaseTools;
    private final OrchestratorProperties.Executor config;

    public ExecutorAgent(DatabaseTools databaseTools, OrchestratorProperties properties, Clock clock) {
        super(clock);
        this.databaseTools = databaseTools;
        this.config = properties.getExecutor();
    }

    @Override
    public Stage stage() {
        return Stage.EXECUTOR;
    }

    @Override
    protected RequestState run(RequestState state) {
        List<Finding> findings = new ArrayList<>();
        List<ToolCallLog> toolCalls = new ArrayList<>();

        for (String task : state.getSubtasks()) {
            if (AgentHeuristics.needsDataAccess(task)) {
                ToolCallLog call = fetchHistory(state.getSessionId());
                toolCalls.add(call);
                findings.add(call.ok()
                        ? Finding.retrieved(task, call.result().count(), call.result().data())
                        : Finding.failed(task, call.result().error()));
            } else {
                findings.add(Finding.completed(task));
            }
        }

        if (state.getRetryCount() > 0) {
            findings.add(Finding.retryMarker(state.getRetryCount()));
        }

        log.info("[sessionId={}] Executor pass done [findings={}, toolCalls={}, retry={}]",
                state.getSessionId(), findings.size(), toolCalls.size(), state.getRetryCount());
        return state.withFindingsAppended(findings, toolCalls);
    }

    private ToolCallLog fetchHistory(String sessionId) {
        String collection = config.getHistoryCollection();
        int limit = config.getQueryLimit();
        Map<String, Object> filter = Map.of("sessionId", sessionId);

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("collection", collection);
        args.put("filter", filter);
        args.put("limit", limit);

        long start = clock.millis();
        QueryResult result;
        try {
            result = databaseTools.find(collection, filter, limit);
        } catch (Exception e) {
            log.warn("[sessionId={}] {} threw: {}", sessionId, DatabaseTools.FIND, e.getMessage());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = QueryResult.error(reason, clock.millis() - start);
        }
        if (!result.isOk()) {
            log.warn("[sessionId={}] {} returned error: {}", sessionId, DatabaseTools.FIND, result.error());
        }

        return new ToolCallLog(DatabaseTools.FIND, args, result, result.latencyMs(), clock.millis());
    }
}
