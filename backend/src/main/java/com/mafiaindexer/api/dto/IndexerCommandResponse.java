package com.mafiaindexer.api.dto;

/**
 * Response for start/stop commands: the state after the command was applied.
 */
public record IndexerCommandResponse(String state, String message) {
}
