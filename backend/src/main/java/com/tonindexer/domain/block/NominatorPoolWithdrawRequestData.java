package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Withdrawal request to a nominator pool. {@code payoutAmount} is set when the pool paid out in the same trace.
 */
public record NominatorPoolWithdrawRequestData(AccountId source, AccountId pool, BigInteger payoutAmount)
        implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NOMINATOR_POOL_WITHDRAW_REQUEST);
    }
}
