package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

@TypeAlias(JettonSwapDetails.NAME)
public record JettonSwapDetails(
        String dex,
        String sender,
        SwapTransferDetails dexIncomingTransfer,
        SwapTransferDetails dexOutgoingTransfer
) implements ActionDetails {

    public static final String NAME = "jetton_swap_data";
}
