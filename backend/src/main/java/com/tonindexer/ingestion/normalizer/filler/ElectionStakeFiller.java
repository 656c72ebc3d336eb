package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.ElectionStakeData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Elector deposits and stake recovery share one mapping.
 */
@Component
public class ElectionStakeFiller implements ActionFiller<ElectionStakeData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.ELECTION_DEPOSIT, BlockType.ELECTION_RECOVER);
    }

    @Override
    public Class<ElectionStakeData> dataType() {
        return ElectionStakeData.class;
    }

    @Override
    public void fill(ElectionStakeData data, ActionDraft draft) {
        draft.setSource(draft.require("stake_holder", resolve(data.stakeHolder())));
        draft.setAmount(data.amount());
    }
}
