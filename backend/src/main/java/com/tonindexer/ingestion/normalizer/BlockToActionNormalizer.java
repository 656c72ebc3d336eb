package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.Action;
import com.tonindexer.domain.Block;
import com.tonindexer.domain.BlockType;
import com.tonindexer.domain.ClassifiedTrace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts classified blocks into actions: base fields, type-specific filling, then account and hash aggregation.
 * Stateless and safe to call concurrently. Never throws for malformed input; problems go to
 * {@link NormalizationDiagnostics} and the action is produced with what could be filled.
 */
@Component
@RequiredArgsConstructor
public class BlockToActionNormalizer {

    private final BaseActionConverter baseActionConverter;
    private final ActionFillerDispatcher dispatcher;
    private final ActionAssembler assembler;
    private final NormalizationDiagnostics diagnostics;

    public Action normalize(Block block, String traceId) {
        ActionDraft draft = baseActionConverter.convert(block, traceId);
        Optional<BlockType> type = BlockType.fromTag(block.btype());
        if (type.isEmpty()) {
            diagnostics.unknownBlockType(block.btype(), traceId);
            return assembler.assemble(draft, block);
        }
        try {
            if (!dispatcher.fill(type.get(), block.data(), draft)) {
                diagnostics.unusablePayload(block.btype(), payloadName(block), traceId);
            }
        } catch (RuntimeException e) {
            diagnostics.fillerFailed(block.btype(), traceId, e);
            draft = baseActionConverter.convert(block, traceId);
        }
        for (String field : draft.missingFields()) {
            diagnostics.missingField(block.btype(), field, traceId, draft.getActionId());
        }
        return assembler.assemble(draft, block);
    }

    public List<Action> normalizeTrace(ClassifiedTrace trace) {
        return trace.blocks().stream()
                .map(block -> normalize(block, trace.traceId()))
                .collect(Collectors.toList());
    }

    private static String payloadName(Block block) {
        return block.data() == null ? "null" : block.data().getClass().getSimpleName();
    }
}
