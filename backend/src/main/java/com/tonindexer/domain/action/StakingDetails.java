package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

/**
 * @param provider staking provider, see {@link #TONSTAKERS} and {@link #NOMINATOR}
 * @param tsNft    Tonstakers withdrawal NFT (minted on delayed request, burnt on payout); null otherwise
 */
@TypeAlias(StakingDetails.NAME)
public record StakingDetails(String provider, String tsNft) implements ActionDetails {

    public static final String NAME = "staking_data";
    public static final String TONSTAKERS = "tonstakers";
    public static final String NOMINATOR = "nominator";
}
