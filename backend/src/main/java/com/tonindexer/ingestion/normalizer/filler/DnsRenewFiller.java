package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.DnsRenewData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

@Component
public class DnsRenewFiller implements ActionFiller<DnsRenewData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.RENEW_DNS);
    }

    @Override
    public Class<DnsRenewData> dataType() {
        return DnsRenewData.class;
    }

    @Override
    public void fill(DnsRenewData data, ActionDraft draft) {
        draft.setSource(resolve(data.source()));
        draft.setDestination(resolve(data.destination()));
    }
}
