package com.tonindexer.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccountIdTest {

    private static final String RAW = "0:ED1691307050047117B998B561D8DE82D31FBF84910CED6EB5FC92E7485EF8A7";

    @Test
    @DisplayName("raw address is normalized to upper-case hex")
    void rawAddressUpperCased() {
        AccountId id = AccountId.of("0:ed1691307050047117b998b561d8de82d31fbf84910ced6eb5fc92e7485ef8a7");

        assertThat(id.workchain()).isZero();
        assertThat(id.asString()).isEqualTo(RAW);
    }

    @Test
    @DisplayName("masterchain workchain is kept")
    void masterchainRaw() {
        AccountId id = AccountId.of("-1:" + "3".repeat(64));

        assertThat(id.workchain()).isEqualTo(-1);
        assertThat(id.asString()).isEqualTo("-1:" + "3".repeat(64));
    }

    @Test
    @DisplayName("user-friendly address resolves to the same raw form")
    void friendlyAddress() {
        AccountId id = AccountId.of("EQDtFpEwcFAEcRe5mLVh2N6C0x-_hJEM7W61_JLnSF74p4q2");

        assertThat(id.asString()).isEqualTo(RAW);
        assertThat(id).isEqualTo(AccountId.of(RAW));
    }

    @Test
    @DisplayName("friendly address with broken checksum is rejected")
    void badChecksum() {
        assertThatThrownBy(() -> AccountId.of("EQDtFpEwcFAEcRe5mLVh2N6C0x-_hJEM7W61_JLnSF74p4q3"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checksum");
    }

    @Test
    @DisplayName("blank, short and unrecognised inputs are rejected")
    void invalidInputs() {
        assertThatThrownBy(() -> AccountId.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccountId.of("0:abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccountId.of("not-an-address")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AccountId.of("0:" + "z".repeat(64)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not hex");
    }
}
