package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(NftMintDetails.NAME)
public record NftMintDetails(BigInteger nftItemIndex) implements ActionDetails {

    public static final String NAME = "nft_mint_data";
}
