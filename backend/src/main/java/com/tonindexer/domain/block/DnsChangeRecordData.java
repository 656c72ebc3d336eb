package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.util.Set;

/**
 * DNS record set on a domain item. {@code key} is the 256-bit record key (sha256 of the category).
 */
public record DnsChangeRecordData(AccountId source, AccountId destination, byte[] key, DnsRecordValue value)
        implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.CHANGE_DNS);
    }
}
