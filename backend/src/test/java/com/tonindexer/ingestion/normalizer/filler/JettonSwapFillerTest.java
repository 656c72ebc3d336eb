package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.Asset;
import com.tonindexer.domain.action.JettonSwapDetails;
import com.tonindexer.domain.action.SwapTransferDetails;
import com.tonindexer.domain.block.JettonSwapData;
import com.tonindexer.domain.block.SwapTransfer;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.tonindexer.ingestion.normalizer.Blocks.account;
import static com.tonindexer.ingestion.normalizer.Blocks.address;
import static com.tonindexer.ingestion.normalizer.Blocks.draft;
import static org.assertj.core.api.Assertions.assertThat;

class JettonSwapFillerTest {

    private final JettonSwapFiller filler = new JettonSwapFiller();

    // user 1 sends TON to pool 5, pool pays jetton 9 from its wallet 6 to user wallet 7
    private final SwapTransfer incoming = new SwapTransfer(BigInteger.valueOf(1000), account(1), null, account(5), null, Asset.TON);
    private final SwapTransfer outgoing = new SwapTransfer(BigInteger.valueOf(250), account(5), account(6), account(1), account(7),
            Asset.jetton(account(9)));

    @Test
    @DisplayName("parties and assets come from the swap legs")
    void legsDriveFields() {
        ActionDraft draft = draft("jetton_swap");

        filler.fill(new JettonSwapData("dedust", account(1), incoming, outgoing, null, null, null), draft);

        assertThat(draft.getSource()).isEqualTo(address(1));
        assertThat(draft.getSourceSecondary()).isNull();
        assertThat(draft.getDestination()).isEqualTo(address(1));
        assertThat(draft.getDestinationSecondary()).isEqualTo(address(7));
        assertThat(draft.getAsset()).isNull();
        assertThat(draft.getAsset2()).isEqualTo(address(9));
        JettonSwapDetails details = (JettonSwapDetails) draft.getDetails();
        assertThat(details.dex()).isEqualTo("dedust");
        assertThat(details.sender()).isEqualTo(address(1));
        assertThat(details.dexIncomingTransfer())
                .isEqualTo(new SwapTransferDetails(BigInteger.valueOf(1000), address(1), null, address(5), null, null));
        assertThat(details.dexOutgoingTransfer().asset()).isEqualTo(address(9));
        assertThat(draft.missingFields()).isEmpty();
    }

    @Test
    @DisplayName("stonfi_v2 takes both assets from the reported source and destination assets")
    void stonfiV2Assets() {
        ActionDraft draft = draft("jetton_swap");

        filler.fill(new JettonSwapData("stonfi_v2", account(1), incoming, outgoing,
                Asset.jetton(account(11)), Asset.jetton(account(12)), null), draft);

        assertThat(draft.getAsset()).isEqualTo(address(11));
        assertThat(draft.getAsset2()).isEqualTo(address(12));
    }

    @Test
    @DisplayName("reported destination wallet and asset override the outgoing leg")
    void destinationOverrides() {
        ActionDraft draft = draft("jetton_swap");

        filler.fill(new JettonSwapData("stonfi", account(1), incoming, outgoing,
                null, Asset.jetton(account(13)), account(14)), draft);

        assertThat(draft.getDestinationSecondary()).isEqualTo(address(14));
        assertThat(draft.getAsset2()).isEqualTo(address(13));
        assertThat(draft.getAsset()).isNull();
    }

    @Test
    @DisplayName("missing legs are reported and leave parties empty")
    void missingLegs() {
        ActionDraft draft = draft("jetton_swap");

        filler.fill(new JettonSwapData("stonfi", account(1), null, null, null, null, null), draft);

        assertThat(draft.getSource()).isNull();
        assertThat(draft.getDestination()).isNull();
        assertThat(draft.missingFields()).containsExactly("dex_incoming_transfer", "dex_outgoing_transfer");
        assertThat(((JettonSwapDetails) draft.getDetails()).dexIncomingTransfer()).isNull();
    }
}
