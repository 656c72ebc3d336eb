package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * tsTON burnt against a delayed payout; {@code mintedNft} is the withdrawal receipt, null for instant payouts.
 */
public record TonstakersWithdrawRequestData(
        AccountId source,
        AccountId tsTonWallet,
        AccountId pool,
        BigInteger tokensBurnt,
        AccountId mintedNft
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TONSTAKERS_WITHDRAWAL_REQUEST);
    }
}
