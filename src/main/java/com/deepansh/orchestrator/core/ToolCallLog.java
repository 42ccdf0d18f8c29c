package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.tool.QueryResult;

import java.util.Map;

/**
 * Log entry for one query issued by the executor.
 *
 * @param tool      tool name, e.g. {@code db.find}
 * @param args      collection / filter / limit as sent to the store
 * @param result    outcome as returned (or synthesized when the call threw)
 * @param latencyMs measured call latency
 * @param timestamp epoch milliseconds the call completed
 */
public record ToolCallLog(String tool,
                          Map<String, Object> args,
                          QueryResult result,
                          double latencyMs,
                          long timestamp) {

    public ToolCallLog {
        args = args != null ? Map.copyOf(args) : Map.of();
    }

    public boolean ok() {
        return result != null && result.isOk();
    }
}
