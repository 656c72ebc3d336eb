package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.JVaultStakeDetails;
import com.tonindexer.domain.block.JVaultStakeData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class JVaultStakeFiller implements ActionFiller<JVaultStakeData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_STAKE);
    }

    @Override
    public Class<JVaultStakeData> dataType() {
        return JVaultStakeData.class;
    }

    @Override
    public void fill(JVaultStakeData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setSourceSecondary(resolve(data.stakeWallet()));
        draft.setDestination(resolve(data.stakingPool()));
        draft.setAmount(data.stakedAmount());
        draft.setDetails(new JVaultStakeDetails(data.period(), data.mintedStakeJettons()));
    }
}
