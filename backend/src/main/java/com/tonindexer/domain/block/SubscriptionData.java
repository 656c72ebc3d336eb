package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Wallet plugin subscription event. {@code amount} is only carried by subscribe (payment); null on unsubscribe.
 */
public record SubscriptionData(
        AccountId subscriber,
        AccountId beneficiary,
        AccountId subscription,
        BigInteger amount
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.SUBSCRIBE, BlockType.UNSUBSCRIBE);
    }
}
