package com.tonindexer.domain;

import java.util.List;

/**
 * Blocks detected in one trace, in classifier order.
 */
public record ClassifiedTrace(String traceId, List<Block> blocks) {

    public ClassifiedTrace {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
