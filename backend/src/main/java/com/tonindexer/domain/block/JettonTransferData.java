package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.math.BigInteger;
import java.util.Set;

/**
 * Jetton transfer routed sender wallet → receiver wallet.
 *
 * @param comment          raw comment bytes from the forward payload; UTF-8 text unless {@code encryptedComment}
 * @param customPayload    serialized custom payload cell (base64 BoC), may be null
 * @param forwardPayload   serialized forward payload cell (base64 BoC), may be null
 */
public record JettonTransferData(
        AccountId sender,
        AccountId senderWallet,
        AccountId receiver,
        AccountId receiverWallet,
        BigInteger amount,
        Asset asset,
        BigInteger queryId,
        AccountId responseAddress,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        byte[] comment,
        boolean encryptedComment
) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.JETTON_TRANSFER);
    }
}
