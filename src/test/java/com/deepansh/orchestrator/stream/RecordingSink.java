package com.deepansh.orchestrator.stream;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory sink. Optionally closes itself after a number of delivered events,
 * the way a client disconnecting mid-stream would look to the relay.
 */
class RecordingSink implements EventSink {

    final List<StreamEvent> events = new ArrayList<>();
    final List<String> log = new ArrayList<>();
    private final int closeAfter;
    private boolean open = true;
    boolean completed;

    RecordingSink() {
        this(Integer.MAX_VALUE);
    }

    RecordingSink(int closeAfter) {
        this.closeAfter = closeAfter;
    }

    @Override
    public void send(StreamEvent event) throws IOException {
        if (!open) {
            throw new IOException("closed");
        }
        events.add(event);
        log.add(event.name());
        if (events.size() >= closeAfter) {
            open = false;
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void complete() {
        completed = true;
        open = false;
    }

    List<String> names() {
        return events.stream().map(StreamEvent::name).toList();
    }

    String tokenText() {
        StringBuilder sb = new StringBuilder();
        events.stream()
                .filter(e -> e.name().equals(StreamEvent.TOKEN))
                .forEach(e -> sb.append(((StreamEvent.Token) e.payload()).text()));
        return sb.toString();
    }

    StreamEvent last() {
        return events.get(events.size() - 1);
    }
}
