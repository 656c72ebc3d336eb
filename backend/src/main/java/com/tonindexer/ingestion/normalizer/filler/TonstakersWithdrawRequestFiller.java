package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.StakingDetails;
import com.tonindexer.domain.block.TonstakersWithdrawRequestData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * {@code amount} is the tsTON burnt; the payout arrives later as a separate withdrawal.
 */
@Component
public class TonstakersWithdrawRequestFiller implements ActionFiller<TonstakersWithdrawRequestData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TONSTAKERS_WITHDRAWAL_REQUEST);
    }

    @Override
    public Class<TonstakersWithdrawRequestData> dataType() {
        return TonstakersWithdrawRequestData.class;
    }

    @Override
    public void fill(TonstakersWithdrawRequestData data, ActionDraft draft) {
        draft.setType(ActionTypes.STAKE_WITHDRAWAL_REQUEST);
        draft.setSource(resolve(data.source()));
        draft.setSourceSecondary(resolve(data.tsTonWallet()));
        draft.setDestination(resolve(data.pool()));
        draft.setAmount(data.tokensBurnt());
        draft.setDetails(new StakingDetails(StakingDetails.TONSTAKERS, resolve(data.mintedNft())));
    }
}
