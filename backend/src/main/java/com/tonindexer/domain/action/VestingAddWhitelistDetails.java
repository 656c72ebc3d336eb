package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;
import java.util.List;

@TypeAlias(VestingAddWhitelistDetails.NAME)
public record VestingAddWhitelistDetails(BigInteger queryId, List<String> accountsAdded) implements ActionDetails {

    public static final String NAME = "vesting_add_whitelist_data";
}
