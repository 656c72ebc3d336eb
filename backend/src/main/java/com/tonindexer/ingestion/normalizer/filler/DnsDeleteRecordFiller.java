package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.ChangeDnsRecordDetails;
import com.tonindexer.domain.block.DnsDeleteRecordData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Deletion is a record change with an empty value.
 */
@Component
public class DnsDeleteRecordFiller implements ActionFiller<DnsDeleteRecordData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.DELETE_DNS);
    }

    @Override
    public Class<DnsDeleteRecordData> dataType() {
        return DnsDeleteRecordData.class;
    }

    @Override
    public void fill(DnsDeleteRecordData data, ActionDraft draft) {
        draft.setSource(resolve(data.source()));
        draft.setDestination(draft.require("destination", resolve(data.destination())));
        draft.setDetails(ChangeDnsRecordDetails.deleted(DnsChangeRecordFiller.hexKey(data.key())));
    }
}
