package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.Block;
import com.tonindexer.domain.EventNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Final step after filling: collects participant accounts, adds the initiating transaction to the extended hash
 * set and freezes the draft. Output lists are sorted so the same block always yields the same document.
 */
@Component
@RequiredArgsConstructor
public class ActionAssembler {

    private final NormalizationDiagnostics diagnostics;

    public Action assemble(ActionDraft draft, Block block) {
        List<String> accounts = new ArrayList<>(draft.getAccounts());
        accounts.add(draft.getSource());
        accounts.add(draft.getSourceSecondary());
        accounts.add(draft.getDestination());
        accounts.add(draft.getDestinationSecondary());

        Set<String> extendedTxHashes = new TreeSet<>(draft.getTxHashes());
        EventNode initiator = block.initiatingEventNode();
        if (initiator != null) {
            if (initiator.txHash() != null) {
                extendedTxHashes.add(initiator.txHash());
            }
            String initiatorAccount = AddressResolver.resolve(initiator.account());
            if (!initiator.isTickTock() && initiatorAccount != null) {
                if (!accounts.contains(initiatorAccount)) {
                    diagnostics.initiatorAccountAdded(initiator.txHash(), initiatorAccount,
                            draft.getTraceId(), draft.getActionId());
                }
                accounts.add(initiatorAccount);
            }
        }
        return draft.toAction(BaseActionConverter.sortedDistinct(accounts), new ArrayList<>(extendedTxHashes));
    }
}
