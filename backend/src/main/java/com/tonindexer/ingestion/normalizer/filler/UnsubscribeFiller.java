package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.SubscriptionData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class UnsubscribeFiller implements ActionFiller<SubscriptionData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.UNSUBSCRIBE);
    }

    @Override
    public Class<SubscriptionData> dataType() {
        return SubscriptionData.class;
    }

    @Override
    public void fill(SubscriptionData data, ActionDraft draft) {
        fillParties(data, draft);
    }

    /** Beneficiary is optional; the subscription plugin goes to {@code destinationSecondary}. */
    static void fillParties(SubscriptionData data, ActionDraft draft) {
        draft.setSource(draft.require("subscriber", resolve(data.subscriber())));
        draft.setDestination(resolve(data.beneficiary()));
        draft.setDestinationSecondary(draft.require("subscription", resolve(data.subscription())));
    }
}
