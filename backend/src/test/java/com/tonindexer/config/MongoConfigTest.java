package com.tonindexer.config;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.action.ChangeDnsRecordDetails;
import com.tonindexer.domain.action.StakingDetails;
import com.tonindexer.domain.action.TonTransferDetails;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    @Test
    @DisplayName("action and every details type are managed up front")
    void managedTypes() {
        assertThat(MongoConfig.managedTypes())
                .hasSize(17)
                .contains(Action.class, TonTransferDetails.class, ChangeDnsRecordDetails.class, StakingDetails.class);
    }

    @Test
    @DisplayName("amounts beyond 64 bits survive the string conversion")
    void bigIntegerConversion() {
        BigInteger amount = new BigInteger("340282366920938463463374607431768211457");

        String stored = new BigIntegerToStringConverter().convert(amount);

        assertThat(stored).isEqualTo("340282366920938463463374607431768211457");
        assertThat(new StringToBigIntegerConverter().convert(stored)).isEqualTo(amount);
    }
}
