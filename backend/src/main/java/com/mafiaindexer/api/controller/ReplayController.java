package com.mafiaindexer.api.controller;

import com.mafiaindexer.api.dto.ReplayResponse;
import com.mafiaindexer.indexer.ReplayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Out-of-band processing: replay one transaction by signature or reindex a slot range.
 * Both are queued and answered with 202; GET /replays/{id} follows the request. A signature request's id
 * is the signature itself.
 */
@RestController
@RequestMapping("/api/v1/indexer")
@RequiredArgsConstructor
public class ReplayController {

    private final ReplayService replayService;

    @PostMapping("/transactions/{signature}")
    public ResponseEntity<ReplayResponse> replaySignature(@PathVariable String signature) {
        return ResponseEntity.accepted().body(ReplayResponse.from(replayService.queueSignature(signature)));
    }

    @PostMapping("/reindex")
    public ResponseEntity<ReplayResponse> reindex(@RequestParam long fromSlot,
                                                  @RequestParam(required = false) Long toSlot) {
        return ResponseEntity.accepted().body(ReplayResponse.from(replayService.queueReindex(fromSlot, toSlot)));
    }

    @GetMapping("/replays/{id}")
    public ResponseEntity<ReplayResponse> replay(@PathVariable String id) {
        return replayService.find(id)
                .map(ReplayResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
