package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

/**
 * NFT transfer metadata. Auction bids reuse this shape with only {@code nftItemIndex} set.
 */
@TypeAlias(NftTransferDetails.NAME)
public record NftTransferDetails(
        BigInteger queryId,
        Boolean isPurchase,
        BigInteger price,
        BigInteger nftItemIndex,
        BigInteger forwardAmount,
        String customPayload,
        String forwardPayload,
        String responseDestination
) implements ActionDetails {

    public static final String NAME = "nft_transfer_data";

    public static NftTransferDetails itemIndexOnly(BigInteger nftItemIndex) {
        return new NftTransferDetails(null, null, null, nftItemIndex, null, null, null, null);
    }
}
