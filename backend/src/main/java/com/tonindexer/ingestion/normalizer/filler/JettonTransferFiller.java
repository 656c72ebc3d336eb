package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.JettonTransferDetails;
import com.tonindexer.domain.block.JettonTransferData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Owners go to source/destination, their jetton wallets to the secondary fields.
 */
@Component
public class JettonTransferFiller implements ActionFiller<JettonTransferData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_TRANSFER);
    }

    @Override
    public Class<JettonTransferData> dataType() {
        return JettonTransferData.class;
    }

    @Override
    public void fill(JettonTransferData data, ActionDraft draft) {
        draft.setSource(draft.require("sender", resolve(data.sender())));
        draft.setSourceSecondary(draft.require("sender_wallet", resolve(data.senderWallet())));
        draft.setDestination(draft.require("receiver", resolve(data.receiver())));
        draft.setDestinationSecondary(resolve(data.receiverWallet()));
        draft.setAmount(data.amount());
        draft.setAsset(resolve(data.asset()));
        draft.setDetails(new JettonTransferDetails(
                data.queryId(),
                resolve(data.responseAddress()),
                data.forwardAmount(),
                data.customPayload(),
                data.forwardPayload(),
                Comments.render(data.comment(), data.encryptedComment()),
                data.encryptedComment()));
    }
}
