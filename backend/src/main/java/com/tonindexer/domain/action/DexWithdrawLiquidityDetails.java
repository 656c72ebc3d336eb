package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(DexWithdrawLiquidityDetails.NAME)
public record DexWithdrawLiquidityDetails(
        String dex,
        BigInteger amount1,
        BigInteger amount2,
        String assetOut1,
        String assetOut2,
        String userJettonWallet1,
        String userJettonWallet2,
        String dexJettonWallet1,
        String dexWallet1,
        String dexWallet2,
        String dexJettonWallet2,
        boolean isRefund,
        BigInteger lpTokensBurnt
) implements ActionDetails {

    public static final String NAME = "dex_withdraw_liquidity_data";
}
