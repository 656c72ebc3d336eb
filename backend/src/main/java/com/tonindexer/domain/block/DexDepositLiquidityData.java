package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

public record DexDepositLiquidityData(
        String dex,
        AccountId sender,
        AccountId pool,
        Asset asset1,
        Asset asset2,
        BigInteger amount1,
        BigInteger amount2,
        AccountId senderWallet1,
        AccountId senderWallet2,
        BigInteger lpTokensMinted
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEX_DEPOSIT_LIQUIDITY);
    }
}
