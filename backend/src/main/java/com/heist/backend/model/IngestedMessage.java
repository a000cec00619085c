package com.heist.backend.model;

/**
 * Raw text handed over by an ingestion collaborator. The message id may be null.
 */
public record IngestedMessage(String text, String platform, String channel, String messageId) {
}
