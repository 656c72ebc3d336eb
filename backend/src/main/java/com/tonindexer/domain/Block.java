package com.tonindexer.domain;

import java.util.List;

/**
 * Operation detected by the upstream classifier. Immutable input of the normalizer.
 *
 * @param btype               raw operation tag; see {@link BlockType#fromTag(String)}
 * @param eventNodes          transactions forming the operation
 * @param data                typed payload; null when the classifier attached none
 * @param initiatingEventNode node that started the chain of effects; may lie outside {@code eventNodes}, may be null
 */
public record Block(
        String btype,
        List<EventNode> eventNodes,
        BlockData data,
        long minLt,
        long maxLt,
        long minUtime,
        long maxUtime,
        boolean failed,
        EventNode initiatingEventNode
) {

    public Block {
        eventNodes = eventNodes == null ? List.of() : List.copyOf(eventNodes);
    }
}
