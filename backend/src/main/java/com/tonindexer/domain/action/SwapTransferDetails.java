package com.tonindexer.domain.action;

import java.math.BigInteger;

/**
 * Swap leg with addresses already resolved; {@code asset} is null for the native coin.
 */
public record SwapTransferDetails(
        BigInteger amount,
        String source,
        String sourceJettonWallet,
        String destination,
        String destinationJettonWallet,
        String asset
) {
}
