package com.mafiaindexer.ingestion.dispatch;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.ParsedEvent;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Test handler that records every event and optionally fails.
 */
class RecordingEventHandler implements EventHandler {

    final List<ParsedEvent> handled = new ArrayList<>();
    private final Set<EventKind> kinds;
    private RuntimeException failure;

    RecordingEventHandler(EventKind first, EventKind... rest) {
        this.kinds = EnumSet.of(first, rest);
    }

    void failWith(RuntimeException e) {
        this.failure = e;
    }

    @Override
    public Set<EventKind> kinds() {
        return kinds;
    }

    @Override
    public void handle(HandlerContext context, ParsedEvent event) {
        handled.add(event);
        if (failure != null) {
            throw failure;
        }
    }
}
