package com.mafiaindexer.domain;

import java.util.Objects;

/**
 * Unique identity of one decoded event: (signature, instructionIndex, eventIndex).
 */
public record DedupKey(String signature, int instructionIndex, int eventIndex) {

    public DedupKey {
        Objects.requireNonNull(signature, "signature");
    }

    @Override
    public String toString() {
        return signature + "#" + instructionIndex + ":" + eventIndex;
    }
}
