package com.deepansh.orchestrator.stream;

import java.io.IOException;

/**
 * Destination for stream events. Closed once the client goes away.
 */
public interface EventSink {

    void send(StreamEvent event) throws IOException;

    boolean isOpen();

    /** Ends the stream normally. No-op when already closed. */
    void complete();
}
