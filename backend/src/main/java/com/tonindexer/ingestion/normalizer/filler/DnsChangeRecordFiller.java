package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.ChangeDnsRecordDetails;
import com.tonindexer.domain.block.DnsChangeRecordData;
import com.tonindexer.domain.block.DnsRecordValue;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Record value is flattened by schema: resolver and smart-contract records keep a contract address, ADNL records
 * the hex ADNL address, text records the text. Flags exist for smart-contract and ADNL records only.
 */
@Component
public class DnsChangeRecordFiller implements ActionFiller<DnsChangeRecordData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.CHANGE_DNS);
    }

    @Override
    public Class<DnsChangeRecordData> dataType() {
        return DnsChangeRecordData.class;
    }

    @Override
    public void fill(DnsChangeRecordData data, ActionDraft draft) {
        draft.setSource(resolve(data.source()));
        draft.setDestination(draft.require("destination", resolve(data.destination())));
        String key = hexKey(data.key());
        DnsRecordValue value = draft.require("value", data.value());
        if (value == null || value.schema() == null) {
            draft.setDetails(ChangeDnsRecordDetails.deleted(key));
            return;
        }
        String address = null;
        Integer flags = null;
        String dnsText = null;
        switch (value.schema()) {
            case NEXT_RESOLVER -> address = resolve(value.address());
            case SMC_ADDRESS -> {
                address = resolve(value.address());
                flags = value.flags();
            }
            case ADNL_ADDRESS -> {
                address = value.adnlAddress() != null ? HexFormat.of().formatHex(value.adnlAddress()) : null;
                flags = value.flags();
            }
            case TEXT -> dnsText = value.dnsText();
            case STORAGE_ADDRESS -> {
                // schema name only
            }
        }
        draft.setDetails(new ChangeDnsRecordDetails(key, value.schema().schemaName(), flags, address, dnsText));
    }

    static String hexKey(byte[] key) {
        return key != null ? HexFormat.of().formatHex(key) : null;
    }
}
