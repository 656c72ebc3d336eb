package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Liquidity withdrawal: LP tokens burnt from {@code senderWallet}, both pool sides paid out.
 * {@code asset} is the LP token.
 */
public record DexWithdrawLiquidityData(
        String dex,
        AccountId sender,
        AccountId senderWallet,
        AccountId pool,
        Asset asset,
        BigInteger amount1Out,
        BigInteger amount2Out,
        Asset asset1Out,
        Asset asset2Out,
        AccountId wallet1,
        AccountId wallet2,
        AccountId dexJettonWallet1,
        AccountId dexWallet1,
        AccountId dexWallet2,
        AccountId dexJettonWallet2,
        boolean isRefund,
        BigInteger lpTokensBurnt
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEX_WITHDRAW_LIQUIDITY);
    }
}
