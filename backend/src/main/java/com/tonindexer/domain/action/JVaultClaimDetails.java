package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;
import java.util.List;

@TypeAlias(JVaultClaimDetails.NAME)
public record JVaultClaimDetails(List<String> claimedJettons, List<BigInteger> claimedAmounts)
        implements ActionDetails {

    public static final String NAME = "jvault_claim_data";
}
