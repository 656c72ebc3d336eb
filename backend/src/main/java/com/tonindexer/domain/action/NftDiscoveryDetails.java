package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(NftDiscoveryDetails.NAME)
public record NftDiscoveryDetails(BigInteger queryId, String collectionAddress, BigInteger nftItemIndex)
        implements ActionDetails {

    public static final String NAME = "nft_discovery_data";
}
