package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record JVaultUnstakeData(
        AccountId sender,
        AccountId stakeWallet,
        AccountId stakingPool,
        BigInteger unstakedAmount
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_UNSTAKE);
    }
}
