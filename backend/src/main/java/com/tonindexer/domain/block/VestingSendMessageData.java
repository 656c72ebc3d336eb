package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Owner asks a vesting wallet to send a message; {@code messageBoc} is the forwarded message (base64 BoC).
 */
public record VestingSendMessageData(
        BigInteger queryId,
        AccountId sender,
        AccountId vesting,
        AccountId messageDestination,
        BigInteger messageValue,
        String messageBoc
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.VESTING_SEND_MESSAGE);
    }
}
