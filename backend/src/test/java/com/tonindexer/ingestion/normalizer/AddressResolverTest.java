package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.Asset;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressResolverTest {

    @Test
    void resolve_account_returnsRawForm() {
        assertThat(AddressResolver.resolve(Blocks.account(10))).isEqualTo("0:" + "A".repeat(64));
        assertThat(AddressResolver.resolve((AccountId) null)).isNull();
    }

    @Test
    void resolve_asset_nativeCoinHasNoAddress() {
        assertThat(AddressResolver.resolve(Asset.TON)).isNull();
        assertThat(AddressResolver.resolve((Asset) null)).isNull();
        assertThat(AddressResolver.resolve(Asset.jetton(Blocks.account(5)))).isEqualTo(Blocks.address(5));
    }
}
