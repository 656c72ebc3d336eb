package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

/**
 * Two-sided liquidity deposit. {@code lpTokensMinted} is null while the deposit is still partial.
 */
@TypeAlias(DexDepositLiquidityDetails.NAME)
public record DexDepositLiquidityDetails(
        String dex,
        BigInteger amount1,
        BigInteger amount2,
        String asset1,
        String asset2,
        String userJettonWallet1,
        String userJettonWallet2,
        BigInteger lpTokensMinted
) implements ActionDetails {

    public static final String NAME = "dex_deposit_liquidity_data";
}
