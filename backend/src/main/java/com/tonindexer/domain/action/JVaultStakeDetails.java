package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(JVaultStakeDetails.NAME)
public record JVaultStakeDetails(Long period, BigInteger mintedStakeJettons) implements ActionDetails {

    public static final String NAME = "jvault_stake_data";
}
