package com.mafiaindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * High-water mark of the indexer, one document per indexed program (id = program id).
 * lastProcessedSlot never decreases.
 */
@Document(collection = "indexer_checkpoint")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexerCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long lastProcessedSlot;
    private String lastProcessedSignature;
    private Instant updatedAt;
}
