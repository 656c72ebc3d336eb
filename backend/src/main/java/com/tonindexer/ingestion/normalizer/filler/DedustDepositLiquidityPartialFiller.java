package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.DedustDepositLiquidityData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Deposit still waiting for the second side: no pool destination yet and nothing minted.
 */
@Component
public class DedustDepositLiquidityPartialFiller implements ActionFiller<DedustDepositLiquidityData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DEDUST_DEPOSIT_LIQUIDITY_PARTIAL);
    }

    @Override
    public Class<DedustDepositLiquidityData> dataType() {
        return DedustDepositLiquidityData.class;
    }

    @Override
    public void fill(DedustDepositLiquidityData data, ActionDraft draft) {
        draft.setType(ActionTypes.DEX_DEPOSIT_LIQUIDITY);
        draft.setSource(resolve(data.sender()));
        draft.setDestinationSecondary(resolve(data.depositContract()));
        draft.setDetails(DedustDepositLiquidityFiller.details(data, null));
    }
}
