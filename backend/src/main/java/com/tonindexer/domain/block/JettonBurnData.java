package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record JettonBurnData(AccountId owner, AccountId jettonWallet, Asset asset, BigInteger amount)
        implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_BURN);
    }
}
