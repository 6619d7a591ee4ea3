package com.mafiaindexer.ingestion.store;

import com.mafiaindexer.domain.DedupKey;
import com.mafiaindexer.domain.ParsedEvent;
import com.mafiaindexer.domain.StoredEvent;
import com.mafiaindexer.domain.StoredEventRepository;
import com.mafiaindexer.domain.StoredEventStatus;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.Base64;

/**
 * Stores decoded events at most once per (signature, instructionIndex, eventIndex).
 * The unique index is the source of truth; the existence check avoids a write error that would abort the
 * surrounding Mongo transaction. Outside a transaction a lost insert race is reported as DUPLICATE; inside one
 * the DuplicateKeyException propagates so the unit is retried and then sees the row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdempotentEventStore {

    private final StoredEventRepository repository;
    private final MongoTemplate mongoTemplate;
    private final IndexerProperties indexerProperties;

    public StoreOutcome storeEvent(ParsedEvent event) {
        DedupKey key = event.dedupKey();
        if (repository.existsBySignatureAndInstructionIndexAndEventIndex(key.signature(), key.instructionIndex(), key.eventIndex())) {
            return StoreOutcome.DUPLICATE;
        }
        try {
            repository.insert(toDocument(event));
            return StoreOutcome.INSERTED;
        } catch (DuplicateKeyException e) {
            if (TransactionSynchronizationManager.isActualTransactionActive()) {
                throw e;
            }
            log.debug("Concurrent insert of {} resolved as duplicate", key);
            return StoreOutcome.DUPLICATE;
        }
    }

    public void markProcessed(DedupKey key) {
        mongoTemplate.updateFirst(byKey(key), new Update()
                .set("status", StoredEventStatus.PROCESSED)
                .set("processedAt", Instant.now()), StoredEvent.class);
    }

    public void markFailed(DedupKey key, String errorMessage) {
        mongoTemplate.updateFirst(byKey(key), new Update()
                .set("status", StoredEventStatus.FAILED)
                .set("errorMessage", errorMessage)
                .set("processedAt", Instant.now()), StoredEvent.class);
    }

    private static Query byKey(DedupKey key) {
        return Query.query(Criteria.where("signature").is(key.signature())
                .and("instructionIndex").is(key.instructionIndex())
                .and("eventIndex").is(key.eventIndex()));
    }

    private StoredEvent toDocument(ParsedEvent event) {
        StoredEvent doc = new StoredEvent();
        doc.setSignature(event.signature());
        doc.setInstructionIndex(event.instructionIndex());
        doc.setEventIndex(event.eventIndex());
        doc.setEventKind(event.kind());
        doc.setSlot(event.slot());
        doc.setBlockTime(event.blockTime());
        doc.setPlayerWallet(event.playerWallet().orElse(null));
        doc.setBusinessMint(event.businessMint().orElse(null));
        doc.setFields(event.fields());
        doc.setRawData(Base64.getEncoder().encodeToString(event.raw()));
        doc.setOrigin(event.origin());
        doc.setPartial(event.partial());
        doc.setStatus(StoredEventStatus.PENDING);
        doc.setIndexerVersion(indexerProperties.getIndexerVersion());
        doc.setCreatedAt(Instant.now());
        return doc;
    }
}
