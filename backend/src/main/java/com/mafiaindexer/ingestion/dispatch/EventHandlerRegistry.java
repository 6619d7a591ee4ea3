package com.mafiaindexer.ingestion.dispatch;

import com.mafiaindexer.domain.EventKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static EventKind → handler map built from the EventHandler beans at startup. At most one handler per kind.
 * With no handler beans at all every kind is routed to {@link LoggingEventHandler}.
 */
@Component
@Slf4j
public class EventHandlerRegistry {

    private final Map<EventKind, EventHandler> handlers;

    public EventHandlerRegistry(List<EventHandler> eventHandlers) {
        List<EventHandler> effective = eventHandlers.isEmpty() ? List.of(new LoggingEventHandler()) : eventHandlers;
        Map<EventKind, EventHandler> map = new EnumMap<>(EventKind.class);
        for (EventHandler handler : effective) {
            for (EventKind kind : handler.kinds()) {
                EventHandler previous = map.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Two handlers for " + kind + ": "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        this.handlers = Collections.unmodifiableMap(map);
        log.info("Event handlers registered for {} of {} event kinds", handlers.size(), EventKind.values().length);
    }

    public Optional<EventHandler> handlerFor(EventKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
