package com.tonindexer.domain.block;

/**
 * TL-B schema of a DNS record value. The wire names are stored verbatim in the action.
 */
public enum DnsValueSchema {
    NEXT_RESOLVER("DNSNextResolver"),
    SMC_ADDRESS("DNSSmcAddress"),
    ADNL_ADDRESS("DNSAdnlAddress"),
    STORAGE_ADDRESS("DNSStorageAddress"),
    TEXT("DNSText");

    private final String schemaName;

    DnsValueSchema(String schemaName) {
        this.schemaName = schemaName;
    }

    public String schemaName() {
        return schemaName;
    }
}
