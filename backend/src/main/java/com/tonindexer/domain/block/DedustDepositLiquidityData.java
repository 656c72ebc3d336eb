package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * DeDust deposit through a deposit contract. The partial form (one side deposited, pool not yet minted)
 * has no pool address and no minted amount.
 */
public record DedustDepositLiquidityData(
        String dex,
        AccountId sender,
        AccountId poolAddress,
        AccountId depositContract,
        Asset asset1,
        BigInteger amount1,
        Asset asset2,
        BigInteger amount2,
        AccountId userJettonWallet1,
        AccountId userJettonWallet2,
        BigInteger lpTokensMinted
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEDUST_DEPOSIT_LIQUIDITY, BlockType.DEDUST_DEPOSIT_LIQUIDITY_PARTIAL);
    }
}
