package com.deepansh.orchestrator.stream;

/**
 * The client disconnected; the run must stop without emitting or persisting anything more.
 */
public class StreamCancelledException extends RuntimeException {

    public StreamCancelledException(String message) {
        super(message);
    }

    public StreamCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
