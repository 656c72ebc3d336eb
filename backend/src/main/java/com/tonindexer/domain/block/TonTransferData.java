package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Native coin transfer. {@code comment} is the decoded text comment, or the raw comment when {@code encrypted}.
 */
public record TonTransferData(
        AccountId source,
        AccountId destination,
        BigInteger value,
        String comment,
        boolean encrypted
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.TON_TRANSFER);
    }
}
