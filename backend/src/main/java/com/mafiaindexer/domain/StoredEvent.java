package com.mafiaindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Raw decoded event as stored. One row per dedup key; the unique index is what makes replays safe.
 * Never deleted; status and errorMessage record the outcome of the handler run.
 */
@Document(collection = "events")
@CompoundIndex(name = "dedup_key", def = "{'signature': 1, 'instructionIndex': 1, 'eventIndex': 1}", unique = true)
@CompoundIndex(name = "player_slot", def = "{'playerWallet': 1, 'slot': -1}")
@CompoundIndex(name = "kind_slot", def = "{'eventKind': 1, 'slot': -1}")
@CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StoredEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String signature;
    private int instructionIndex;
    private int eventIndex;
    private EventKind eventKind;
    private long slot;
    private Instant blockTime;
    /** Extracted for per-player queries by downstream consumers. */
    private String playerWallet;
    private String businessMint;
    private Map<String, Object> fields;
    /** Base64 of the payload after the discriminator. Empty for log-text events. */
    private String rawData;
    private EventOrigin origin;
    private boolean partial;
    private StoredEventStatus status;
    private String errorMessage;
    private String indexerVersion;
    private Instant createdAt;
    private Instant processedAt;

    public DedupKey dedupKey() {
        return new DedupKey(signature, instructionIndex, eventIndex);
    }
}
