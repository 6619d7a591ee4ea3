package com.mafiaindexer.api.controller;

import com.mafiaindexer.api.dto.IndexerCommandResponse;
import com.mafiaindexer.api.dto.IndexerStatusResponse;
import com.mafiaindexer.domain.IndexerState;
import com.mafiaindexer.indexer.EventIndexer;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Indexer lifecycle endpoints: status snapshot, start, stop. Start and stop are idempotent
 * and return without waiting for the event source; poll the status for STOPPED.
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class IndexerController {

    private final EventIndexer eventIndexer;

    @GetMapping("/status")
    public ResponseEntity<IndexerStatusResponse> status() {
        return ResponseEntity.ok(IndexerStatusResponse.from(eventIndexer.snapshot()));
    }

    @PostMapping("/start")
    public ResponseEntity<IndexerCommandResponse> start() {
        IndexerState state = eventIndexer.start();
        return ResponseEntity.accepted().body(new IndexerCommandResponse(state.name(), "Indexer start requested"));
    }

    @PostMapping("/stop")
    public ResponseEntity<IndexerCommandResponse> stop() {
        IndexerState state = eventIndexer.stop();
        return ResponseEntity.accepted().body(new IndexerCommandResponse(state.name(), "Indexer stop requested"));
    }
}
