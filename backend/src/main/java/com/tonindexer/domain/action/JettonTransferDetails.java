package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

/**
 * @param comment UTF-8 text comment, or base64 of the raw bytes when {@code isEncryptedComment}
 */
@TypeAlias(JettonTransferDetails.NAME)
public record JettonTransferDetails(
        BigInteger queryId,
        String responseDestination,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        String comment,
        boolean isEncryptedComment
) implements ActionDetails {

    public static final String NAME = "jetton_transfer_data";
}
