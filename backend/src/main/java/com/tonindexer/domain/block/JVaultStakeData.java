package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record JVaultStakeData(
        AccountId sender,
        AccountId stakeWallet,
        AccountId stakingPool,
        BigInteger stakedAmount,
        Long period,
        BigInteger mintedStakeJettons
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_STAKE);
    }
}
