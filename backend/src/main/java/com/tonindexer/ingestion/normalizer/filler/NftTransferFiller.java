package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.NftTransferDetails;
import com.tonindexer.domain.block.NftItemRef;
import com.tonindexer.domain.block.NftTransferData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Collection goes to {@code asset}, the item itself to {@code assetSecondary}.
 */
@Component
public class NftTransferFiller implements ActionFiller<NftTransferData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_TRANSFER);
    }

    @Override
    public Class<NftTransferData> dataType() {
        return NftTransferData.class;
    }

    @Override
    public void fill(NftTransferData data, ActionDraft draft) {
        draft.setSource(resolve(data.prevOwner()));
        draft.setDestination(draft.require("new_owner", resolve(data.newOwner())));
        NftItemRef nft = draft.require("nft", data.nft());
        if (nft != null) {
            draft.setAssetSecondary(resolve(nft.address()));
            draft.setAsset(resolve(nft.collection()));
        }
        draft.setDetails(new NftTransferDetails(
                data.queryId(),
                data.isPurchase(),
                data.isPurchase() ? data.price() : null,
                nft != null ? nft.index() : null,
                data.forwardAmount(),
                data.customPayload(),
                data.forwardPayload(),
                resolve(data.responseDestination())));
    }
}
