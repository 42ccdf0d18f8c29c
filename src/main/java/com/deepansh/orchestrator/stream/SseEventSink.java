package com.deepansh.orchestrator.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link EventSink} over a Spring {@link SseEmitter}.
 *
 * Completion, timeout and transport errors all close the sink and cancel
 * the attached pipeline task with interruption.
 */
@Slf4j
public class SseEventSink implements EventSink {

    private final SseEmitter emitter;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicReference<Future<?>> task = new AtomicReference<>();

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
        emitter.onCompletion(() -> close("completed"));
        emitter.onTimeout(() -> close("timed out"));
        emitter.onError(ex -> close("error: " + ex.getMessage()));
    }

    /** Task to cancel when the client goes away. */
    public void attach(Future<?> future) {
        task.set(future);
        if (!open.get()) {
            future.cancel(true);
        }
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        if (!open.get()) {
            throw new IOException("Stream already closed");
        }
        try {
            emitter.send(SseEmitter.event()
                    .name(event.name())
                    .data(event.payload(), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            close("send failed: " + e.getMessage());
            throw e instanceof IOException io ? io : new IOException(e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void complete() {
        if (open.compareAndSet(true, false)) {
            emitter.complete();
        }
    }

    private void close(String reason) {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        log.info("SSE stream closed by client side ({})", reason);
        Future<?> future = task.get();
        if (future != null && !future.isDone()) {
            future.cancel(true);
        }
    }
}
