package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.JVaultUnstakeData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class JVaultUnstakeFiller implements ActionFiller<JVaultUnstakeData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_UNSTAKE);
    }

    @Override
    public Class<JVaultUnstakeData> dataType() {
        return JVaultUnstakeData.class;
    }

    @Override
    public void fill(JVaultUnstakeData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setSourceSecondary(resolve(data.stakeWallet()));
        draft.setDestination(resolve(data.stakingPool()));
        draft.setAmount(data.unstakedAmount());
    }
}
