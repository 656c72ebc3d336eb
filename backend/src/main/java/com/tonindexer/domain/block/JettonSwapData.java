package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.util.Set;

/**
 * DEX swap. {@code sourceAsset}, {@code destinationAsset} and {@code destinationWallet} are reported only by
 * some DEX implementations and override what the legs imply.
 */
public record JettonSwapData(
        String dex,
        AccountId sender,
        SwapTransfer dexIncomingTransfer,
        SwapTransfer dexOutgoingTransfer,
        Asset sourceAsset,
        Asset destinationAsset,
        AccountId destinationWallet
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_SWAP);
    }
}
