package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

/**
 * A statement in the body of a graph or subgraph.
 */
public sealed interface DotStatement
        permits NodeStatement, EdgeStatement, SubgraphStatement,
        AttributeStatement {

    /**
     * Get where the statement starts.
     *
     * @return the source position
     */
    SourcePosition position();
}
