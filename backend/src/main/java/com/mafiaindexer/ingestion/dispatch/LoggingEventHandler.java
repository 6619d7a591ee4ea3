package com.mafiaindexer.ingestion.dispatch;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.ParsedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handler used when no domain handlers are deployed: records each event in the log only.
 */
@Slf4j
public class LoggingEventHandler implements EventHandler {

    @Override
    public Set<EventKind> kinds() {
        return EnumSet.allOf(EventKind.class);
    }

    @Override
    public void handle(HandlerContext context, ParsedEvent event) {
        log.debug("{} player={} slot={} tx={} fields={}",
                event.kind().getEventName(),
                event.playerWallet().orElse("-"),
                context.slot(),
                context.signature(),
                event.fields());
    }
}
