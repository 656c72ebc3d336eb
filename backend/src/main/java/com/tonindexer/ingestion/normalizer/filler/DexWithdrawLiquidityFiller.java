package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.DexWithdrawLiquidityDetails;
import com.tonindexer.domain.block.DexWithdrawLiquidityData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class DexWithdrawLiquidityFiller implements ActionFiller<DexWithdrawLiquidityData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEX_WITHDRAW_LIQUIDITY);
    }

    @Override
    public Class<DexWithdrawLiquidityData> dataType() {
        return DexWithdrawLiquidityData.class;
    }

    @Override
    public void fill(DexWithdrawLiquidityData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setSourceSecondary(resolve(data.senderWallet()));
        draft.setDestination(resolve(data.pool()));
        draft.setAsset(resolve(data.asset()));
        draft.setDetails(new DexWithdrawLiquidityDetails(
                data.dex(),
                data.amount1Out(),
                data.amount2Out(),
                resolve(data.asset1Out()),
                resolve(data.asset2Out()),
                resolve(data.wallet1()),
                resolve(data.wallet2()),
                resolve(data.dexJettonWallet1()),
                resolve(data.dexWallet1()),
                resolve(data.dexWallet2()),
                resolve(data.dexJettonWallet2()),
                data.isRefund(),
                data.lpTokensBurnt()));
    }
}
