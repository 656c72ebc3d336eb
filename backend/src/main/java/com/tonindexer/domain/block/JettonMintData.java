package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Jetton mint. {@code amount} and {@code tonAmount} are null when the mint message did not carry them.
 */
public record JettonMintData(
        AccountId to,
        AccountId toJettonWallet,
        Asset asset,
        BigInteger amount,
        BigInteger tonAmount
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_MINT);
    }
}
