package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

/**
 * Reward claim. {@code claimedJettons} and {@code claimedAmounts} are parallel lists.
 */
public record JVaultClaimData(
        AccountId sender,
        AccountId stakeWallet,
        AccountId stakingPool,
        List<Asset> claimedJettons,
        List<BigInteger> claimedAmounts
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JVAULT_CLAIM);
    }
}
