package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.DexDepositLiquidityDetails;
import com.tonindexer.domain.block.DexDepositLiquidityData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class DexDepositLiquidityFiller implements ActionFiller<DexDepositLiquidityData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEX_DEPOSIT_LIQUIDITY);
    }

    @Override
    public Class<DexDepositLiquidityData> dataType() {
        return DexDepositLiquidityData.class;
    }

    @Override
    public void fill(DexDepositLiquidityData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setDestination(resolve(data.pool()));
        draft.setDetails(new DexDepositLiquidityDetails(
                data.dex(),
                data.amount1(),
                data.amount2(),
                resolve(data.asset1()),
                resolve(data.asset2()),
                resolve(data.senderWallet1()),
                resolve(data.senderWallet2()),
                data.lpTokensMinted()));
    }
}
