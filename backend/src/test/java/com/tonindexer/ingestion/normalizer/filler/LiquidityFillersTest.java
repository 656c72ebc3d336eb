package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.Asset;
import com.tonindexer.domain.action.DexDepositLiquidityDetails;
import com.tonindexer.domain.action.DexWithdrawLiquidityDetails;
import com.tonindexer.domain.block.DedustDepositLiquidityData;
import com.tonindexer.domain.block.DexDepositLiquidityData;
import com.tonindexer.domain.block.DexWithdrawLiquidityData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.tonindexer.ingestion.normalizer.Blocks.account;
import static com.tonindexer.ingestion.normalizer.Blocks.address;
import static com.tonindexer.ingestion.normalizer.Blocks.draft;
import static org.assertj.core.api.Assertions.assertThat;

class LiquidityFillersTest {

    private DedustDepositLiquidityData dedust(BigInteger minted) {
        return new DedustDepositLiquidityData("dedust", account(1), account(5), account(6),
                Asset.TON, BigInteger.valueOf(100), Asset.jetton(account(9)), BigInteger.valueOf(200),
                null, account(7), minted);
    }

    @Test
    @DisplayName("generic deposit maps sender to pool with both sides in details")
    void dexDeposit() {
        ActionDraft draft = draft("dex_deposit_liquidity");

        new DexDepositLiquidityFiller().fill(new DexDepositLiquidityData("stonfi_v2", account(1), account(5),
                Asset.jetton(account(8)), Asset.jetton(account(9)), BigInteger.ONE, BigInteger.TWO,
                account(2), account(3), BigInteger.TEN), draft);

        assertThat(draft.getType()).isEqualTo("dex_deposit_liquidity");
        assertThat(draft.getSource()).isEqualTo(address(1));
        assertThat(draft.getDestination()).isEqualTo(address(5));
        assertThat(draft.getDetails()).isEqualTo(new DexDepositLiquidityDetails("stonfi_v2",
                BigInteger.ONE, BigInteger.TWO, address(8), address(9), address(2), address(3), BigInteger.TEN));
    }

    @Test
    @DisplayName("completed DeDust deposit is a dex deposit to the pool")
    void dedustComplete() {
        ActionDraft draft = draft("dedust_deposit_liquidity");

        new DedustDepositLiquidityFiller().fill(dedust(BigInteger.valueOf(300)), draft);

        assertThat(draft.getType()).isEqualTo("dex_deposit_liquidity");
        assertThat(draft.getDestination()).isEqualTo(address(5));
        assertThat(draft.getDestinationSecondary()).isEqualTo(address(6));
        DexDepositLiquidityDetails details = (DexDepositLiquidityDetails) draft.getDetails();
        assertThat(details.asset1()).isNull();
        assertThat(details.asset2()).isEqualTo(address(9));
        assertThat(details.userJettonWallet2()).isEqualTo(address(7));
        assertThat(details.lpTokensMinted()).isEqualTo(BigInteger.valueOf(300));
    }

    @Test
    @DisplayName("partial DeDust deposit has no pool destination and nothing minted")
    void dedustPartial() {
        ActionDraft draft = draft("dedust_deposit_liquidity_partial");

        new DedustDepositLiquidityPartialFiller().fill(dedust(BigInteger.valueOf(300)), draft);

        assertThat(draft.getType()).isEqualTo("dex_deposit_liquidity");
        assertThat(draft.getSource()).isEqualTo(address(1));
        assertThat(draft.getDestination()).isNull();
        assertThat(draft.getDestinationSecondary()).isEqualTo(address(6));
        assertThat(((DexDepositLiquidityDetails) draft.getDetails()).lpTokensMinted()).isNull();
    }

    @Test
    @DisplayName("withdrawal puts LP token in asset and payouts in details")
    void withdraw() {
        ActionDraft draft = draft("dex_withdraw_liquidity");

        new DexWithdrawLiquidityFiller().fill(new DexWithdrawLiquidityData("dedust", account(1), account(2), account(5),
                Asset.jetton(account(10)), BigInteger.valueOf(11), BigInteger.valueOf(12),
                Asset.TON, Asset.jetton(account(9)), null, account(3), null, account(4), null, account(6),
                true, BigInteger.valueOf(20)), draft);

        assertThat(draft.getSource()).isEqualTo(address(1));
        assertThat(draft.getSourceSecondary()).isEqualTo(address(2));
        assertThat(draft.getDestination()).isEqualTo(address(5));
        assertThat(draft.getAsset()).isEqualTo(address(10));
        DexWithdrawLiquidityDetails details = (DexWithdrawLiquidityDetails) draft.getDetails();
        assertThat(details.assetOut1()).isNull();
        assertThat(details.assetOut2()).isEqualTo(address(9));
        assertThat(details.userJettonWallet2()).isEqualTo(address(3));
        assertThat(details.dexWallet1()).isEqualTo(address(4));
        assertThat(details.dexJettonWallet2()).isEqualTo(address(6));
        assertThat(details.isRefund()).isTrue();
        assertThat(details.lpTokensBurnt()).isEqualTo(BigInteger.valueOf(20));
    }
}
