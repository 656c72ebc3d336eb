package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.NftDiscoveryDetails;
import com.tonindexer.domain.block.NftDiscoveryData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class NftDiscoveryFiller implements ActionFiller<NftDiscoveryData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.NFT_DISCOVERY);
    }

    @Override
    public Class<NftDiscoveryData> dataType() {
        return NftDiscoveryData.class;
    }

    @Override
    public void fill(NftDiscoveryData data, ActionDraft draft) {
        draft.setSource(draft.require("sender", resolve(data.sender())));
        draft.setDestination(draft.require("nft", resolve(data.nft())));
        draft.setDetails(new NftDiscoveryDetails(
                data.queryId(),
                resolve(data.resultCollection()),
                data.resultIndex()));
    }
}
