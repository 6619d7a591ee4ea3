package com.mafiaindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for indexer_checkpoint. Writes go through CheckpointStore, which enforces monotonicity.
 */
public interface IndexerCheckpointRepository extends MongoRepository<IndexerCheckpoint, String> {
}
