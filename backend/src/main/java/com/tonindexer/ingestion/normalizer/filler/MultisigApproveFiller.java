package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.action.MultisigApproveDetails;
import com.tonindexer.domain.block.MultisigApproveData;
import com.tonindexer.ingestion.normalizer.ActionDraft;
import org.springframework.stereotype.Component;

import java.util.Set;

import static com.tonindexer.ingestion.normalizer.AddressResolver.resolve;

/**
 * The order contract's own verdict replaces the trace-level success flag.
 */
@Component
public class MultisigApproveFiller implements ActionFiller<MultisigApproveData> {

    @Override
    public Set<BlockType> blockTypes() {
        return Set.of(BlockType.MULTISIG_APPROVE);
    }

    @Override
    public Class<MultisigApproveData> dataType() {
        return MultisigApproveData.class;
    }

    @Override
    public void fill(MultisigApproveData data, ActionDraft draft) {
        draft.setSource(resolve(data.signer()));
        draft.setDestination(resolve(data.order()));
        draft.setSuccess(data.success());
        draft.setDetails(new MultisigApproveDetails(data.signerIndex(), data.exitCode()));
    }
}
