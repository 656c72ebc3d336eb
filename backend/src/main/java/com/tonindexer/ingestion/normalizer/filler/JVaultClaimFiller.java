package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.JVaultClaimDetails;
import com.tonindexer.domain.block.JVaultClaimData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class JVaultClaimFiller implements ActionFiller<JVaultClaimData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_CLAIM);
    }

    @Override
    public Class<JVaultClaimData> dataType() {
        return JVaultClaimData.class;
    }

    @Override
    public void fill(JVaultClaimData data, ActionDraft draft) {
        draft.setSource(resolve(data.sender()));
        draft.setSourceSecondary(resolve(data.stakeWallet()));
        draft.setDestination(resolve(data.stakingPool()));
        List<String> jettons = new ArrayList<>();
        if (data.claimedJettons() != null) {
            for (Asset jetton : data.claimedJettons()) {
                jettons.add(resolve(jetton));
            }
        }
        List<BigInteger> amounts = data.claimedAmounts() != null ? new ArrayList<>(data.claimedAmounts()) : List.of();
        draft.setDetails(new JVaultClaimDetails(jettons, amounts));
    }
}
