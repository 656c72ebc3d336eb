package com.tonindexer.domain.action;

import org.springframework.data.annotation.TypeAlias;

/**
 * DNS record change. A deleted record keeps only {@code key}; all value fields are null.
 *
 * @param key     record key, lower-case hex
 * @param address contract address (raw form) or ADNL address (hex), depending on {@code valueSchema}
 */
@TypeAlias(ChangeDnsRecordDetails.NAME)
public record ChangeDnsRecordDetails(
        String key,
        String valueSchema,
        Integer flags,
        String address,
        String dnsText
) implements ActionDetails {

    public static final String NAME = "change_dns_record_data";

    public static ChangeDnsRecordDetails deleted(String key) {
        return new ChangeDnsRecordDetails(key, null, null, null, null);
    }
}
