package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Block;
import com.tonindexer.domain.EventNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the part of an action every operation type shares: id, tx hashes, time bounds, success and the accounts
 * owning the block's transactions.
 */
@Component
@RequiredArgsConstructor
public class BaseActionConverter {

    private final ActionIdCalculator actionIdCalculator;

    public ActionDraft convert(Block block, String traceId) {
        ActionDraft draft = new ActionDraft(traceId, actionIdCalculator.calculate(block), block.btype());
        draft.setTxHashes(sortedDistinct(block.eventNodes().stream()
                .map(EventNode::txHash)
                .collect(Collectors.toList())));
        for (EventNode node : block.eventNodes()) {
            draft.addAccount(AddressResolver.resolve(node.account()));
        }
        draft.setStartLt(block.minLt());
        draft.setEndLt(block.maxLt());
        draft.setStartUtime(block.minUtime());
        draft.setEndUtime(block.maxUtime());
        draft.setSuccess(!block.failed());
        return draft;
    }

    static List<String> sortedDistinct(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }
}
