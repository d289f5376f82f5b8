package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

/**
 * One side of an edge operator: a node identifier or a subgraph.
 */
public sealed interface EdgeOperand permits NodeReference, SubgraphStatement {

    /**
     * Get where the operand starts.
     *
     * @return the source position
     */
    SourcePosition position();
}
