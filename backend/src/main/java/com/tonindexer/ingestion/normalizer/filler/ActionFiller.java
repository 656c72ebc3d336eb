package com.tonindexer.ingestion.normalizer.filler;

import com.tonindexer.domain.BlockData;
import com.tonindexer.domain.BlockType;
import com.tonindexer.ingestion.normalizer.ActionDraft;

import java.util.Set;

/**
 * Maps one operation payload onto the generic action fields and its type-specific details.
 * Implementations are pure: they only read {@code data} and write {@code draft}.
 */
public interface ActionFiller<D extends BlockData> {

    /** Block types this filler is registered for. */
    Set<BlockType> blockTypes();

    Class<D> dataType();

    void fill(D data, ActionDraft draft);
}
