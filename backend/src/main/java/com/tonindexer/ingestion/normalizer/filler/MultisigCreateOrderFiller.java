package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.MultisigCreateOrderDetails;
import com.tonindexer.domain.block.MultisigCreateOrderData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Creator → multisig; the order contract deployed for it goes to {@code destinationSecondary}.
 */
@Component
public class MultisigCreateOrderFiller implements ActionFiller<MultisigCreateOrderData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.MULTISIG_CREATE_ORDER);
    }

    @Override
    public Class<MultisigCreateOrderData> dataType() {
        return MultisigCreateOrderData.class;
    }

    @Override
    public void fill(MultisigCreateOrderData data, ActionDraft draft) {
        draft.setSource(resolve(data.createdBy()));
        draft.setDestination(resolve(data.multisig()));
        draft.setDestinationSecondary(resolve(data.orderContractAddress()));
        draft.setDetails(new MultisigCreateOrderDetails(
                data.queryId(),
                data.orderSeqno(),
                data.isCreatedBySigner(),
                data.creatorApproved(),
                data.creatorIndex(),
                data.expirationDate(),
                data.orderBoc()));
    }
}
