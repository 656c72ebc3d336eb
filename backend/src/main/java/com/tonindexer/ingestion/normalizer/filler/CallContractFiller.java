package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.block.CallContractData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * Contract calls and deploys map the same way.
 */
@Component
public class CallContractFiller implements ActionFiller<CallContractData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.CALL_CONTRACT, BlockType.CONTRACT_DEPLOY);
    }

    @Override
    public Class<CallContractData> dataType() {
        return CallContractData.class;
    }

    @Override
    public void fill(CallContractData data, ActionDraft draft) {
        draft.setOpcode(data.opcode());
        draft.setValue(data.value());
        draft.setSource(resolve(data.source()));
        draft.setDestination(resolve(data.destination()));
    }
}
