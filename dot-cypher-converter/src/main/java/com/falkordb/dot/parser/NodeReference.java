package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

/**
 * A node identifier used as an edge endpoint.
 *
 * @param identifier the DOT node identifier
 * @param position where the identifier appears
 */
public record NodeReference(String identifier, SourcePosition position)
        implements EdgeOperand {
}
