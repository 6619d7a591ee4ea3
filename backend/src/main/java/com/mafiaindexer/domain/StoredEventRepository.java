package com.mafiaindexer.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for events. Unique on (signature, instructionIndex, eventIndex).
 */
public interface StoredEventRepository extends MongoRepository<StoredEvent, String> {

    boolean existsBySignatureAndInstructionIndexAndEventIndex(String signature, int instructionIndex, int eventIndex);

    List<StoredEvent> findBySignatureOrderByInstructionIndexAscEventIndexAsc(String signature);

    List<StoredEvent> findByStatusOrderByCreatedAtAsc(StoredEventStatus status, Pageable pageable);

    long countByEventKind(EventKind eventKind);
}
