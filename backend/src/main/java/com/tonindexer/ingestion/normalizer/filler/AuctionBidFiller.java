package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.NftTransferDetails;
import com.tonindexer.domain.block.AuctionBidData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Bid on an NFT auction (e.g. a .ton domain). The bid is the {@code value} sent to the auction.
 */
@Component
public class AuctionBidFiller implements ActionFiller<AuctionBidData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.AUCTION_BID);
    }

    @Override
    public Class<AuctionBidData> dataType() {
        return AuctionBidData.class;
    }

    @Override
    public void fill(AuctionBidData data, ActionDraft draft) {
        draft.setSource(draft.require("bidder", resolve(data.bidder())));
        draft.setDestination(draft.require("auction", resolve(data.auction())));
        draft.setAssetSecondary(draft.require("nft_address", resolve(data.nftAddress())));
        draft.setAsset(resolve(data.nftCollection()));
        draft.setDetails(NftTransferDetails.itemIndexOnly(data.nftItemIndex()));
        draft.setValue(data.amount());
    }
}
