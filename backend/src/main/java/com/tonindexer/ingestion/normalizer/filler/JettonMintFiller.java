package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.JettonMintData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Amounts stay null when the mint did not carry them; null means unknown, not zero.
 */
@Component
public class JettonMintFiller implements ActionFiller<JettonMintData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_MINT);
    }

    @Override
    public Class<JettonMintData> dataType() {
        return JettonMintData.class;
    }

    @Override
    public void fill(JettonMintData data, ActionDraft draft) {
        draft.setDestination(resolve(data.to()));
        draft.setDestinationSecondary(resolve(data.toJettonWallet()));
        draft.setAsset(draft.require("asset", resolve(data.asset())));
        draft.setAmount(data.amount());
        draft.setValue(data.tonAmount());
    }
}
