package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.EventOrigin;
import com.mafiaindexer.domain.ParsedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stateless discriminator-based decoder. Unknown discriminators and payloads too short for the first field
 * produce no event; anything longer decodes every field that fits. Never throws on payload content.
 */
@Component
@Slf4j
public class EventDecoder {

    public Optional<ParsedEvent> decode(byte[] discriminator, byte[] payload, DecodeContext ctx) {
        Optional<EventKind> kind = EventKind.fromDiscriminator(discriminator);
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        return decode(kind.get(), payload != null ? payload : new byte[0], ctx);
    }

    Optional<ParsedEvent> decode(EventKind kind, byte[] payload, DecodeContext ctx) {
        EventLayout primary = EventLayouts.primary(kind);
        if (payload.length < primary.minimumLength()) {
            log.warn("Undersized {} payload ({} bytes, need {}) in tx {}",
                    kind.getEventName(), payload.length, primary.minimumLength(), ctx.signature());
            return Optional.empty();
        }
        EventLayout layout = EventLayouts.select(kind, payload.length);
        PayloadReader reader = new PayloadReader(payload);
        Map<String, Object> fields = new LinkedHashMap<>();
        boolean partial = false;
        for (FieldSpec field : layout.fields()) {
            Optional<Object> value = reader.read(field);
            if (value.isPresent()) {
                fields.put(field.name(), value.get());
            } else {
                partial = true;
            }
        }
        if (layout.blockTimeField() != null && !fields.containsKey(layout.blockTimeField()) && ctx.blockTime() != null) {
            fields.put(layout.blockTimeField(), ctx.blockTime().getEpochSecond());
        }
        if (partial) {
            log.debug("Partial {} decode with {} layout: {} of {} bytes, fields {} in tx {}",
                    kind.getEventName(), layout.variant(), payload.length, layout.fullLength(), fields.keySet(), ctx.signature());
        }
        return Optional.of(new ParsedEvent(
                kind,
                ctx.signature(),
                ctx.slot(),
                ctx.blockTime(),
                ctx.instructionIndex(),
                ctx.eventIndex(),
                fields,
                payload,
                partial,
                EventOrigin.PROGRAM_DATA));
    }
}
