package com.mafiaindexer.ingestion.notify;

import com.mafiaindexer.domain.ParsedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LoggingEventNotificationPublisher implements EventNotificationPublisher {

    @Override
    public void publish(ParsedEvent event) {
        log.info("Notify {} for player {} (tx {})",
                event.kind().getEventName(), event.playerWallet().orElse("-"), event.signature());
    }
}
