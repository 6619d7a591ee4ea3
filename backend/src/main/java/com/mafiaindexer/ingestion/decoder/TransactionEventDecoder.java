package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.domain.ParsedEvent;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import com.mafiaindexer.ingestion.decoder.ProgramLogParser.EncodedEvent;
import com.mafiaindexer.ingestion.decoder.ProgramLogParser.ParsedLogs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static com.mafiaindexer.domain.EventKind.DISCRIMINATOR_LENGTH;

/**
 * Turns one transaction's logs into events in log order: "Program data:" payloads first, then the log-text
 * fallback when nothing structured decoded.
 */
@Component
@Slf4j
public class TransactionEventDecoder {

    private final EventDecoder eventDecoder;
    private final ProgramLogParser logParser;

    public TransactionEventDecoder(EventDecoder eventDecoder, IndexerProperties properties) {
        this.eventDecoder = eventDecoder;
        this.logParser = new ProgramLogParser(properties.getProgramId());
    }

    public List<ParsedEvent> decode(ProgramTransaction tx) {
        ParsedLogs parsed = logParser.parse(tx.logs());
        List<ParsedEvent> events = new ArrayList<>();
        for (EncodedEvent encoded : parsed.events()) {
            decodeOne(tx, encoded).ifPresent(events::add);
        }
        if (events.isEmpty() && !parsed.programLogs().isEmpty()) {
            List<ParsedEvent> recovered = LogTextEventExtractor.extract(tx, parsed.programLogs());
            if (!recovered.isEmpty()) {
                log.debug("Recovered {} event(s) from log text in tx {}", recovered.size(), tx.signature());
            }
            events.addAll(recovered);
        }
        return events;
    }

    private Optional<ParsedEvent> decodeOne(ProgramTransaction tx, EncodedEvent encoded) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(encoded.base64());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid base64 in program data of tx {} (instruction {}, event {}): {}",
                    tx.signature(), encoded.instructionIndex(), encoded.eventIndex(), e.getMessage());
            return Optional.empty();
        }
        if (bytes.length < DISCRIMINATOR_LENGTH) {
            log.debug("Program data shorter than a discriminator in tx {}", tx.signature());
            return Optional.empty();
        }
        byte[] discriminator = Arrays.copyOfRange(bytes, 0, DISCRIMINATOR_LENGTH);
        byte[] payload = Arrays.copyOfRange(bytes, DISCRIMINATOR_LENGTH, bytes.length);
        DecodeContext ctx = new DecodeContext(tx.signature(), tx.slot(), tx.blockTime(),
                encoded.instructionIndex(), encoded.eventIndex());
        return eventDecoder.decode(discriminator, payload, ctx);
    }
}
