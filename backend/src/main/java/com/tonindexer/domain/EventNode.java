package com.tonindexer.domain;

/**
 * One transaction of a trace as seen by the classifier.
 *
 * @param lt      logical time of the transaction
 * @param txHash  transaction hash (may be null for synthetic nodes)
 * @param account account owning the transaction, i.e. the receiver of {@code message}
 * @param message inbound message; null for tick-tock transactions
 */
public record EventNode(long lt, String txHash, AccountId account, InboundMessage message) {

    public boolean isTickTock() {
        return message == null;
    }
}
