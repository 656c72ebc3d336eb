package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;

/**
 * Parsed DNS record value. Which fields are set depends on {@code schema}:
 * NEXT_RESOLVER and SMC_ADDRESS carry {@code address} (SMC_ADDRESS also {@code flags}),
 * ADNL_ADDRESS carries {@code adnlAddress} and {@code flags}, TEXT carries {@code dnsText}.
 */
public record DnsRecordValue(
        DnsValueSchema schema,
        AccountId address,
        byte[] adnlAddress,
        Integer flags,
        String dnsText
) {
}
