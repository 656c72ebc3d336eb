package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.JettonSwapDetails;
import com.tonindexer.domain.action.SwapTransferDetails;
import com.tonindexer.domain.block.JettonSwapData;
import com.tonindexer.domain.block.SwapTransfer;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Source side comes from the incoming leg, destination side from the outgoing leg. Assets default to the legs'
 * assets; DEX-reported source/destination assets and destination wallet override them.
 */
@Component
public class JettonSwapFiller implements ActionFiller<JettonSwapData> {

    static final String STONFI_V2 = "stonfi_v2";

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_SWAP);
    }

    @Override
    public Class<JettonSwapData> dataType() {
        return JettonSwapData.class;
    }

    @Override
    public void fill(JettonSwapData data, ActionDraft draft) {
        SwapTransferDetails incoming = leg(draft.require("dex_incoming_transfer", data.dexIncomingTransfer()));
        SwapTransferDetails outgoing = leg(draft.require("dex_outgoing_transfer", data.dexOutgoingTransfer()));

        draft.setAsset(incoming != null ? incoming.asset() : null);
        draft.setAsset2(outgoing != null ? outgoing.asset() : null);
        if (STONFI_V2.equals(data.dex())) {
            draft.setAsset(resolve(data.sourceAsset()));
            draft.setAsset2(resolve(data.destinationAsset()));
        }
        if (incoming != null) {
            draft.setSource(incoming.source());
            draft.setSourceSecondary(incoming.sourceJettonWallet());
        }
        if (outgoing != null) {
            draft.setDestination(outgoing.destination());
            draft.setDestinationSecondary(outgoing.destinationJettonWallet());
        }
        if (data.destinationWallet() != null) {
            draft.setDestinationSecondary(resolve(data.destinationWallet()));
        }
        if (data.destinationAsset() != null) {
            draft.setAsset2(resolve(data.destinationAsset()));
        }
        draft.setDetails(new JettonSwapDetails(data.dex(), resolve(data.sender()), incoming, outgoing));
    }

    private static SwapTransferDetails leg(SwapTransfer transfer) {
        if (transfer == null) {
            return null;
        }
        return new SwapTransferDetails(
                transfer.amount(),
                resolve(transfer.source()),
                resolve(transfer.sourceJettonWallet()),
                resolve(transfer.destination()),
                resolve(transfer.destinationJettonWallet()),
                resolve(transfer.asset()));
    }
}
