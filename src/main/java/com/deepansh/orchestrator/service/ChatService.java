package com.deepansh.orchestrator.service;

import com.deepansh.orchestrator.config.OrchestratorProperties;
import com.deepansh.orchestrator.core.RequestState;
import com.deepansh.orchestrator.memory.ContextPacker;
import com.deepansh.orchestrator.memory.PackedContext;
import com.deepansh.orchestrator.memory.SessionService;
import com.deepansh.orchestrator.model.ChatRequest;
import com.deepansh.orchestrator.observability.ConversationRecorder;
import com.deepansh.orchestrator.stream.EventRelay;
import com.deepansh.orchestrator.stream.EventSink;
import com.deepansh.orchestrator.stream.SseEventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.concurrent.Future;

/**
 * Entry point for one chat turn.
 *
 * Flow, on a pipelineTaskExecutor thread:
 * 1. upsert the session (turn count +1)
 * 2. pack context, before the prompt is saved so it does not appear twice
 * 3. save the user message
 * 4. relay the pipeline; the recorder commits the turn before done
 * 5. complete the stream
 * A failure in 1-3 is reported as the stream's error event.
 */
@Service
@Slf4j
public class ChatService {

    private final SessionService sessionService;
    private final ContextPacker contextPacker;
    private final ConversationRecorder recorder;
    private final EventRelay relay;
    private final ThreadPoolTaskExecutor executor;
    private final Clock clock;
    private final long timeoutMs;

    public ChatService(SessionService sessionService,
                       ContextPacker contextPacker,
                       ConversationRecorder recorder,
                       EventRelay relay,
                       @Qualifier("pipelineTaskExecutor") ThreadPoolTaskExecutor executor,
                       OrchestratorProperties properties,
                       Clock clock) {
        this.sessionService = sessionService;
        this.contextPacker = contextPacker;
        this.recorder = recorder;
        this.relay = relay;
        this.executor = executor;
        this.clock = clock;
        this.timeoutMs = properties.getStream().getTimeoutMs();
    }

    public SseEmitter stream(ChatRequest request) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        SseEventSink sink = new SseEventSink(emitter);
        long requestStart = clock.millis();

        try {
            Future<?> task = executor.submit(() -> handle(request, sink, requestStart));
            sink.attach(task);
        } catch (TaskRejectedException e) {
            log.error("[sessionId={}] Pipeline pool saturated, rejecting request", request.getSessionId());
            relay.emitError(sink, "Server busy, try again shortly");
            sink.complete();
        }
        return emitter;
    }

    void handle(ChatRequest request, EventSink sink, long requestStart) {
        String sessionId = request.getSessionId();
        String userId = request.getUserId();
        log.info("[sessionId={}] Chat turn started [userId={}]", sessionId, userId);

        try {
            RequestState initial;
            try {
                sessionService.upsertSession(sessionId, userId);
                PackedContext packed = contextPacker.pack(sessionId, userId, request.getPrompt());
                recorder.saveUserMessage(sessionId, userId, request.getPrompt());
                initial = RequestState.initial(sessionId, userId, request.getPrompt(), packed, requestStart);
            } catch (Exception e) {
                log.error("[sessionId={}] Failed to prepare request", sessionId, e);
                relay.emitError(sink, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                return;
            }

            EventRelay.Outcome outcome = relay.relay(initial, sink, recorder);
            log.info("[sessionId={}] Chat turn finished [outcome={}]", sessionId, outcome);
        } finally {
            sink.complete();
        }
    }
}
