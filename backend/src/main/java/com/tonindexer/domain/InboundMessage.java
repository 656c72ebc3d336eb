package com.tonindexer.domain;

/**
 * Inbound message that triggered an event node's transaction.
 */
public record InboundMessage(String msgHash, long createdLt) {
}
