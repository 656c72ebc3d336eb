package com.tonindexer.domain.block;

import com.tonindexer.domain.AccountId;
import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;

import java.util.Set;

public record DnsDeleteRecordData(AccountId source, AccountId destination, byte[] key) implements BlockData {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DELETE_DNS);
    }
}
