package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.VestingSendMessageDetails;
import com.tonindexer.domain.block.VestingSendMessageData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class VestingSendMessageFiller implements ActionFiller<VestingSendMessageData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.VESTING_SEND_MESSAGE);
    }

    @Override
    public Class<VestingSendMessageData> dataType() {
        return VestingSendMessageData.class;
    }

    @Override
    public void fill(VestingSendMessageData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setDestination(resolve(data.vesting()));
        // where the vesting wallet forwarded the message, and with how much
        draft.setDestinationSecondary(resolve(data.messageDestination()));
        draft.setAmount(data.messageValue());
        draft.setDetails(new VestingSendMessageDetails(data.queryId(), data.messageBoc()));
    }
}
