package com.mafiaindexer.ingestion.store;

import com.mafiaindexer.domain.IndexerCheckpoint;
import com.mafiaindexer.domain.IndexerCheckpointRepository;
import com.mafiaindexer.ingestion.config.IndexerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable high-water mark for the indexed program. {@link #advance} never moves the slot backwards,
 * so replays and out-of-order live notifications cannot regress it.
 */
@Service
@Slf4j
public class CheckpointStore {

    private final IndexerCheckpointRepository repository;
    private final String checkpointId;

    public CheckpointStore(IndexerCheckpointRepository repository, IndexerProperties properties) {
        this.repository = repository;
        this.checkpointId = properties.getProgramId();
    }

    public Optional<Long> lastProcessedSlot() {
        return repository.findById(checkpointId).map(IndexerCheckpoint::getLastProcessedSlot);
    }

    /**
     * Moves the checkpoint to {@code slot} if it is ahead of the stored value.
     *
     * @param signature last transaction at that slot, or null for a range advance with no transaction
     * @return true when the stored value changed
     */
    public boolean advance(long slot, String signature) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must be non-negative: " + slot);
        }
        IndexerCheckpoint checkpoint = repository.findById(checkpointId).orElse(null);
        if (checkpoint != null && checkpoint.getLastProcessedSlot() >= slot) {
            return false;
        }
        if (checkpoint == null) {
            checkpoint = new IndexerCheckpoint();
            checkpoint.setId(checkpointId);
        }
        checkpoint.setLastProcessedSlot(slot);
        if (signature != null) {
            checkpoint.setLastProcessedSignature(signature);
        }
        checkpoint.setUpdatedAt(Instant.now());
        repository.save(checkpoint);
        log.debug("Checkpoint advanced to slot {}", slot);
        return true;
    }
}
