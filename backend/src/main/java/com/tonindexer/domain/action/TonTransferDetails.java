package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

/**
 * @param content comment text, or the encrypted comment as received when {@code encrypted}
 */
@TypeAlias(TonTransferDetails.NAME)
public record TonTransferDetails(String content, boolean encrypted) implements ActionDetails {

    public static final String NAME = "ton_transfer_data";
}
