package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.StakingDetails;
import com.tonindexer.domain.block.TonstakersWithdrawData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class TonstakersWithdrawFiller implements ActionFiller<TonstakersWithdrawData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TONSTAKERS_WITHDRAWAL);
    }

    @Override
    public Class<TonstakersWithdrawData> dataType() {
        return TonstakersWithdrawData.class;
    }

    @Override
    public void fill(TonstakersWithdrawData data, ActionDraft draft) {
        draft.setType(ActionTypes.STAKE_WITHDRAWAL);
        draft.setSource(resolve(data.stakeHolder()));
        draft.setDestination(resolve(data.pool()));
        draft.setAmount(data.amount());
        draft.setDetails(new StakingDetails(StakingDetails.TONSTAKERS, resolve(data.burntNft())));
    }
}
