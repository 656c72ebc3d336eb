package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Plain contract call or deploy: one message with an opcode.
 */
public record CallContractData(Long opcode, BigInteger value, AccountId source, AccountId destination)
        implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.CALL_CONTRACT, BlockType.CONTRACT_DEPLOY);
    }
}
