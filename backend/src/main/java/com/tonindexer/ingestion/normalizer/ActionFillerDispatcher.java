package com.tonindexer.ingestion.normalizer;

import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;
import com.tonindexer.ingestion.normalizer.filler.ActionFiller;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes a block to the filler registered for its type. Every {@link BlockType} must have exactly one filler;
 * the dispatcher refuses to start otherwise, so a new tag cannot be silently dropped.
 */
@Component
public class ActionFillerDispatcher {

    private final Map<BlockType, ActionFiller<?>> fillers;

    public ActionFillerDispatcher(List<ActionFiller<?>> fillers) {
        Map<BlockType, ActionFiller<?>> byType = new EnumMap<>(BlockType.class);
        for (ActionFiller<?> filler : fillers) {
            for (BlockType type : filler.blockTypes()) {
                ActionFiller<?> previous = byType.put(type, filler);
                if (previous != null) {
                    throw new IllegalStateException("Block type " + type + " handled by both "
                            + previous.getClass().getSimpleName() + " and " + filler.getClass().getSimpleName());
                }
            }
        }
        Set<BlockType> unhandled = EnumSet.allOf(BlockType.class);
        unhandled.removeAll(byType.keySet());
        if (!unhandled.isEmpty()) {
            throw new IllegalStateException("No action filler for block types " + unhandled);
        }
        this.fillers = Collections.unmodifiableMap(byType);
    }

    /**
     * Fill the draft from the block payload.
     *
     * @return false if the payload is null or not a shape this type carries; the draft is then untouched
     */
    public boolean fill(BlockType type, BlockData data, ActionDraft draft) {
        if (data == null || !data.blockTypes().contains(type)) {
            return false;
        }
        return apply(fillers.get(type), data, draft);
    }

    public ActionFiller<?> fillerFor(BlockType type) {
        return fillers.get(type);
    }

    private static <D extends BlockData> boolean apply(ActionFiller<D> filler, BlockData data, ActionDraft draft) {
        if (!filler.dataType().isInstance(data)) {
            return false;
        }
        filler.fill(filler.dataType().cast(data), draft);
        return true;
    }
}
