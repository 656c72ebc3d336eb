package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * NFT ownership transfer, optionally a marketplace purchase ({@code price} is only meaningful then).
 */
public record NftTransferData(
        AccountId prevOwner,
        AccountId newOwner,
        NftItemRef nft,
        BigInteger queryId,
        boolean isPurchase,
        BigInteger price,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        AccountId responseDestination
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_TRANSFER);
    }
}
