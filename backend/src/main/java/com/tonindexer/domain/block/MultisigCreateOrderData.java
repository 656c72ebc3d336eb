package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * New multisig order. {@code orderBoc} is the serialized order body (base64 BoC).
 */
public record MultisigCreateOrderData(
        BigInteger queryId,
        AccountId multisig,
        AccountId createdBy,
        AccountId orderContractAddress,
        BigInteger orderSeqno,
        boolean isCreatedBySigner,
        boolean creatorApproved,
        Long creatorIndex,
        Long expirationDate,
        String orderBoc
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.MULTISIG_CREATE_ORDER);
    }
}
