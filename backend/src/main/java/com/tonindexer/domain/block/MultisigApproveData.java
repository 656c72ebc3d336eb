package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.util.Set;

/**
 * Signer approval of a multisig order. {@code success} reflects the order contract's verdict, not the trace.
 */
public record MultisigApproveData(
        AccountId signer,
        AccountId order,
        Long signerIndex,
        Integer exitCode,
        boolean success
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.MULTISIG_APPROVE);
    }
}
