package com.mafiaindexer.ingestion.notify;

import com.mafiaindexer.domain.ParsedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of committed events to every {@link EventNotificationPublisher} on the
 * notification executor. Each publisher call is its own failure boundary.
 */
@Component
@Slf4j
public class AsyncNotificationDispatcher {

    private final List<EventNotificationPublisher> publishers;
    private final Executor notificationExecutor;

    public AsyncNotificationDispatcher(List<EventNotificationPublisher> publishers,
                                       @Qualifier("notification-executor") Executor notificationExecutor) {
        this.publishers = List.copyOf(publishers);
        this.notificationExecutor = notificationExecutor;
    }

    public void dispatch(List<ParsedEvent> events) {
        if (events.isEmpty() || publishers.isEmpty()) {
            return;
        }
        try {
            notificationExecutor.execute(() -> publishAll(events));
        } catch (RejectedExecutionException e) {
            log.warn("Notification executor rejected {} event(s) of tx {}", events.size(), events.get(0).signature());
        }
    }

    private void publishAll(List<ParsedEvent> events) {
        for (ParsedEvent event : events) {
            for (EventNotificationPublisher publisher : publishers) {
                try {
                    publisher.publish(event);
                } catch (RuntimeException e) {
                    log.warn("Notification via {} failed for {} in tx {}: {}",
                            publisher.getClass().getSimpleName(), event.kind().getEventName(), event.signature(), e.getMessage());
                }
            }
        }
    }
}
