package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * get_static_data request answered by an NFT item.
 */
public record NftDiscoveryData(
        AccountId sender,
        AccountId nft,
        BigInteger queryId,
        AccountId resultCollection,
        BigInteger resultIndex
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_DISCOVERY);
    }
}
