package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

import java.math.BigInteger;

@TypeAlias(VestingSendMessageDetails.NAME)
public record VestingSendMessageDetails(BigInteger queryId, String messageBoc) implements ActionDetails {

    public static final String NAME = "vesting_send_message_data";
}
