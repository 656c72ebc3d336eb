package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.NftMintDetails;
import com.tonindexer.domain.block.NftMintData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class NftMintFiller implements ActionFiller<NftMintData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_MINT);
    }

    @Override
    public Class<NftMintData> dataType() {
        return NftMintData.class;
    }

    @Override
    public void fill(NftMintData data, ActionDraft draft) {
        draft.setSource(resolve(data.source()));
        draft.setDestination(draft.require("address", resolve(data.address())));
        draft.setAssetSecondary(draft.getDestination());
        draft.setOpcode(data.opcode());
        draft.setAsset(resolve(data.collection()));
        draft.setDetails(new NftMintDetails(data.index()));
    }
}
