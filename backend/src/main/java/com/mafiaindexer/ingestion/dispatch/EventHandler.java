package com.mafiaindexer.ingestion.dispatch;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.ParsedEvent;

import java.util.Set;

/**
 * Domain logic applied once per newly stored event. Runs inside the storage transaction of its transaction
 * unit; writes made through {@link HandlerContext#mongoTemplate()} commit or roll back with it.
 * Throwing marks the stored event FAILED without removing it; a Spring DataAccessException instead
 * fails the whole unit so it is retried.
 */
public interface EventHandler {

    Set<EventKind> kinds();

    void handle(HandlerContext context, ParsedEvent event);
}
