package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Native-coin deposit into a staking pool (Tonstakers liquid pool or nominator pool).
 */
public record PoolDepositData(AccountId source, AccountId pool, BigInteger value) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TONSTAKERS_DEPOSIT, BlockType.NOMINATOR_POOL_DEPOSIT);
    }
}
