package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record AuctionBidData(
        AccountId bidder,
        AccountId auction,
        AccountId nftAddress,
        AccountId nftCollection,
        BigInteger nftItemIndex,
        BigInteger amount
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.AUCTION_BID);
    }
}
