package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.StakingDetails;
import com.tonindexer.domain.block.PoolDepositData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class NominatorPoolDepositFiller implements ActionFiller<PoolDepositData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NOMINATOR_POOL_DEPOSIT);
    }

    @Override
    public Class<PoolDepositData> dataType() {
        return PoolDepositData.class;
    }

    @Override
    public void fill(PoolDepositData data, ActionDraft draft) {
        draft.setType(ActionTypes.STAKE_DEPOSIT);
        draft.setSource(draft.require("source", resolve(data.source())));
        draft.setDestination(draft.require("pool", resolve(data.pool())));
        draft.setAmount(data.value());
        draft.setDetails(new StakingDetails(StakingDetails.NOMINATOR, null));
    }
}
