package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.TonTransferDetails;
import com.tonindexer.domain.block.TonTransferData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class TonTransferFiller implements ActionFiller<TonTransferData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TON_TRANSFER);
    }

    @Override
    public Class<TonTransferData> dataType() {
        return TonTransferData.class;
    }

    @Override
    public void fill(TonTransferData data, ActionDraft draft) {
        draft.setValue(data.value());
        draft.setSource(draft.require("source", resolve(data.source())));
        draft.setDestination(draft.require("destination", resolve(data.destination())));
        String content = data.comment() != null ? Comments.stripNul(data.comment()) : null;
        draft.setDetails(new TonTransferDetails(content, data.encrypted()));
    }
}
