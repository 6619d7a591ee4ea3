package com.mafiaindexer.ingestion.notify;

import com.mafiaindexer.domain.ParsedEvent;

/**
 * Outbound notification for a committed, successfully handled event (e.g. push to connected players).
 * Called off the indexing thread; failures are logged by the dispatcher and never reach the pipeline.
 */
public interface EventNotificationPublisher {

    void publish(ParsedEvent event);
}
