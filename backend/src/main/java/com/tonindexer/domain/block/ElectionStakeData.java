package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Validator stake sent to or recovered from the elector. {@code amount} may be null for unanswered recover requests.
 */
public record ElectionStakeData(AccountId stakeHolder, BigInteger amount) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.ELECTION_DEPOSIT, BlockType.ELECTION_RECOVER);
    }
}
