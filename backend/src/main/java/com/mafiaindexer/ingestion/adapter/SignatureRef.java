package com.mafiaindexer.ingestion.adapter;

import java.time.Instant;

/**
 * One successful program transaction as listed by the signature index, before its logs are fetched.
 *
 * @param blockTime null when the node did not report it
 */
public record SignatureRef(String signature, long slot, Instant blockTime) {
}
