package com.tonindexer.domain;

import java.util.Set;

/**
 * Type-specific payload attached to a {@link Block} by the classifier.
 */
public interface BlockData {

    /** Tags this payload shape can be attached to. */
    Set<BlockType> blockTypes();
}
