package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record NftMintData(
        AccountId source,
        AccountId address,
        Long opcode,
        AccountId collection,
        BigInteger index
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_MINT);
    }
}
