package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record TonstakersWithdrawData(
        AccountId stakeHolder,
        AccountId pool,
        BigInteger amount,
        AccountId burntNft
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TONSTAKERS_WITHDRAWAL);
    }
}
