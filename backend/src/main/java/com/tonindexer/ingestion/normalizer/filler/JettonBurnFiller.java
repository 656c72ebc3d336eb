package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.JettonBurnData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class JettonBurnFiller implements ActionFiller<JettonBurnData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_BURN);
    }

    @Override
    public Class<JettonBurnData> dataType() {
        return JettonBurnData.class;
    }

    @Override
    public void fill(JettonBurnData data, ActionDraft draft) {
        draft.setSource(draft.require("owner", resolve(data.owner())));
        draft.setSourceSecondary(draft.require("jetton_wallet", resolve(data.jettonWallet())));
        draft.setAsset(draft.require("asset", resolve(data.asset())));
        draft.setAmount(data.amount());
    }
}
