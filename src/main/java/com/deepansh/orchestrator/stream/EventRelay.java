package com.deepansh.orchestrator.stream;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.PipelineController;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.core.Stage;
import com.deepansh.orchestrator.core.StageObserver;
import com.deepansh.orchestrator.core.ToolCallLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the pipeline and turns its progress into the ordered event stream.
 *
 * Per request the wire carries, in order:
 * <pre>
 *   agent(planner)
 *   agent(executor)  tool_call_started / tool_call_completed per call of that pass
 *   agent(validator)
 *   [agent(executor) ... agent(validator)]   on retry
 *   agent(composer)
 *   token ...        the answer, chunked on whitespace
 *   done             after the commit callback succeeded
 * </pre>
 * or a single error event in place of everything after the failure point.
 * Nothing more is sent once the sink has closed, and a turn committed while
 * the client was leaving is rolled back.
 */
@Component
@Slf4j
public class EventRelay {

    private static final Pattern UNIT = Pattern.compile("\\s*\\S+\\s*");

    public enum Outcome { COMPLETED, FAILED, CANCELLED }

    private final PipelineController controller;
    private final Clock clock;
    private final long tokenDelayMs;

    public EventRelay(PipelineController controller, OrchestratorProperties properties, Clock clock) {
        this.controller = controller;
        this.clock = clock;
        this.tokenDelayMs = properties.getStream().getTokenDelayMs();
    }

    public Outcome relay(RequestState initial, EventSink sink, TurnCommitter committer) {
        String sessionId = initial.getSessionId();
        try {
            RequestState terminal = controller.run(initial, new RelayObserver(sink));
            terminal = streamAnswer(terminal, sink);
            DoneTimings timings = timings(terminal);

            ensureOpen(sink);
            TurnCommitter.CommittedTurn turn = committer.commit(terminal, timings);
            try {
                send(sink, StreamEvent.done(terminal.getFinalAnswer(), terminal.getSuggestions(), timings));
            } catch (StreamCancelledException e) {
                rollback(sessionId, turn);
                throw e;
            }
            log.info("[sessionId={}] Stream done [ttftMs={}, totalMs={}]",
                    sessionId, timings.ttftMs(), timings.totalMs());
            return Outcome.COMPLETED;

        } catch (StreamCancelledException e) {
            log.info("[sessionId={}] Stream cancelled: {}", sessionId, e.getMessage());
            return Outcome.CANCELLED;

        } catch (Exception e) {
            if (!sink.isOpen()) {
                log.info("[sessionId={}] Run aborted after client disconnect: {}", sessionId, e.getMessage());
                return Outcome.CANCELLED;
            }
            log.error("[sessionId={}] Pipeline failed", sessionId, e);
            emitError(sink, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return Outcome.FAILED;
        }
    }

    /**
     * Sends a terminal error event if the client is still there.
     */
    public void emitError(EventSink sink, String message) {
        if (!sink.isOpen()) {
            return;
        }
        try {
            sink.send(StreamEvent.error(message));
        } catch (IOException e) {
            log.warn("Could not deliver error event: {}", e.getMessage());
        }
    }

    /**
     * Whitespace units of {@code text}; each carries the whitespace after it
     * and the first also any leading whitespace, so joining them gives back
     * the input. Blank non-empty text is a single unit.
     */
    static List<String> chunk(String text) {
        List<String> units = new ArrayList<>();
        Matcher m = UNIT.matcher(text);
        while (m.find()) {
            units.add(m.group());
        }
        if (units.isEmpty() && !text.isEmpty()) {
            units.add(text);
        }
        return units;
    }

    private RequestState streamAnswer(RequestState state, EventSink sink) {
        List<String> units = chunk(state.getFinalAnswer());
        Long firstTokenAt = null;
        Long lastTokenAt = null;

        for (int i = 0; i < units.size(); i++) {
            if (i > 0) {
                pause();
            }
            send(sink, StreamEvent.token(units.get(i)));
            lastTokenAt = clock.millis();
            if (firstTokenAt == null) {
                firstTokenAt = lastTokenAt;
            }
        }

        long completedAt = state.getCompletedAt() != null ? state.getCompletedAt() : clock.millis();
        if (lastTokenAt != null && lastTokenAt > completedAt) {
            completedAt = lastTokenAt;
        }
        return state.toBuilder()
                .firstTokenAt(firstTokenAt)
                .completedAt(completedAt)
                .build();
    }

    private static DoneTimings timings(RequestState state) {
        long start = state.getRequestStart();
        Long first = state.getFirstTokenAt();
        long completed = state.getCompletedAt();
        return new DoneTimings(start, first, completed,
                first != null ? first - start : null,
                completed - start);
    }

    private static void rollback(String sessionId, TurnCommitter.CommittedTurn turn) {
        try {
            turn.rollback();
            log.info("[sessionId={}] Client left during commit, turn rolled back", sessionId);
        } catch (RuntimeException e) {
            log.error("[sessionId={}] Client left during commit and rollback failed", sessionId, e);
        }
    }

    private void pause() {
        if (tokenDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(tokenDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamCancelledException("Interrupted while streaming tokens", e);
        }
    }

    private static void ensureOpen(EventSink sink) {
        if (!sink.isOpen()) {
            throw new StreamCancelledException("Client disconnected");
        }
    }

    private static void send(EventSink sink, StreamEvent event) {
        ensureOpen(sink);
        try {
            sink.send(event);
        } catch (IOException e) {
            throw new StreamCancelledException("Failed to send " + event.name() + " event", e);
        }
    }

    /**
     * Emits the agent event for each finished stage and, for executor passes,
     * the tool-call pairs that pass added.
     */
    private static final class RelayObserver implements StageObserver {

        private final EventSink sink;

        RelayObserver(EventSink sink) {
            this.sink = sink;
        }

        @Override
        public void onStageCompleted(Stage stage, RequestState previous, RequestState current) {
            send(sink, StreamEvent.agent(stage.wireName()));

            if (stage == Stage.EXECUTOR) {
                List<ToolCallLog> calls = current.getToolCalls();
                for (ToolCallLog call : calls.subList(previous.getToolCalls().size(), calls.size())) {
                    send(sink, StreamEvent.toolCallStarted(call.tool(), call.args()));
                    send(sink, StreamEvent.toolCallCompleted(call.tool(), call.ok(), call.latencyMs()));
                }
            }
        }
    }
}
