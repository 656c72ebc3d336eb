package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.StakingDetails;
import com.tonindexer.domain.block.NominatorPoolWithdrawRequestData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Without a payout in the trace this is only a request; with one it is a completed withdrawal of that amount.
 */
@Component
public class NominatorPoolWithdrawRequestFiller implements ActionFiller<NominatorPoolWithdrawRequestData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NOMINATOR_POOL_WITHDRAW_REQUEST);
    }

    @Override
    public Class<NominatorPoolWithdrawRequestData> dataType() {
        return NominatorPoolWithdrawRequestData.class;
    }

    @Override
    public void fill(NominatorPoolWithdrawRequestData data, ActionDraft draft) {
        if (data.payoutAmount() == null) {
            draft.setType(ActionTypes.STAKE_WITHDRAWAL_REQUEST);
        } else {
            draft.setType(ActionTypes.STAKE_WITHDRAWAL);
            draft.setAmount(data.payoutAmount());
        }
        draft.setDetails(new StakingDetails(StakingDetails.NOMINATOR, null));
        draft.setSource(draft.require("source", resolve(data.source())));
        draft.setDestination(draft.require("pool", resolve(data.pool())));
    }
}
