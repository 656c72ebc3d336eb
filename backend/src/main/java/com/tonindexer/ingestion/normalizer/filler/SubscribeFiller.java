package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.SubscriptionData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Subscriber pays the beneficiary through the subscription plugin.
 */
@Component
public class SubscribeFiller implements ActionFiller<SubscriptionData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.SUBSCRIBE);
    }

    @Override
    public Class<SubscriptionData> dataType() {
        return SubscriptionData.class;
    }

    @Override
    public void fill(SubscriptionData data, ActionDraft draft) {
        UnsubscribeFiller.fillParties(data, draft);
        draft.setAmount(data.amount());
    }
}
