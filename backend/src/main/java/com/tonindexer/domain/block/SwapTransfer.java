package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;

import java.math.BigInteger;

/**
 * One leg of a DEX swap: either the user's transfer into the pool or the pool's payout.
 */
public record SwapTransfer(
        BigInteger amount,
        AccountId source,
        AccountId sourceJettonWallet,
        AccountId destination,
        AccountId destinationJettonWallet,
        Asset asset
) {
}
