package com.deepansh.orchestrator.stream;

import java.util.List;
import java.util.Map;

/**
 * One named event on the SSE wire with its JSON payload.
 */
public record StreamEvent(String name, Object payload) {

    public static final String AGENT = "agent";
    public static final String TOOL_CALL_STARTED = "tool_call_started";
    public static final String TOOL_CALL_COMPLETED = "tool_call_completed";
    public static final String TOKEN = "token";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static StreamEvent agent(String name) {
        return new StreamEvent(AGENT, new Agent(name));
    }

    public static StreamEvent toolCallStarted(String tool, Map<String, Object> args) {
        return new StreamEvent(TOOL_CALL_STARTED, new ToolCallStarted(tool, args));
    }

    public static StreamEvent toolCallCompleted(String tool, boolean ok, double latencyMs) {
        return new StreamEvent(TOOL_CALL_COMPLETED, new ToolCallCompleted(tool, ok, latencyMs));
    }

    public static StreamEvent token(String text) {
        return new StreamEvent(TOKEN, new Token(text));
    }

    public static StreamEvent done(String fullText, List<String> suggestions, DoneTimings timings) {
        return new StreamEvent(DONE, new Done(fullText, suggestions, timings));
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(ERROR, new Error(message));
    }

    public record Agent(String name) {
    }

    public record ToolCallStarted(String tool, Map<String, Object> args) {
    }

    public record ToolCallCompleted(String tool, boolean ok, double latencyMs) {
    }

    public record Token(String text) {
    }

    public record Done(String fullText, List<String> suggestions, DoneTimings timings) {
    }

    public record Error(String error) {
    }
}
