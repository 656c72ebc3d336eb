package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(MultisigCreateOrderDetails.NAME)
public record MultisigCreateOrderDetails(
        BigInteger queryId,
        BigInteger orderSeqno,
        boolean isCreatedBySigner,
        boolean isSignedByCreator,
        Long creatorIndex,
        Long expirationDate,
        String orderBoc
) implements ActionDetails {

    public static final String NAME = "multisig_create_order_data";
}
