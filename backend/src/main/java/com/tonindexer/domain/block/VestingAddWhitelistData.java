package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

public record VestingAddWhitelistData(
        BigInteger queryId,
        AccountId adder,
        AccountId vesting,
        List<AccountId> accountsAdded
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.VESTING_ADD_WHITELIST);
    }
}
