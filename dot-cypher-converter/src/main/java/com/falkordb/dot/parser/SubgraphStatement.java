package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

import java.util.List;

/**
 * A {@code subgraph} or anonymous {@code { ... }} block.
 *
 * <p>Its statements belong to the enclosing graph; the block only groups
 * nodes, for example to fan out an edge as in {@code a -> {b c}}.</p>
 *
 * @param name the subgraph name, or null if anonymous
 * @param statements the body statements in source order
 * @param position where the block starts
 */
public record SubgraphStatement(String name, List<DotStatement> statements,
        SourcePosition position) implements DotStatement, EdgeOperand {

    /**
     * Copies the body.
     *
     * @param name the name
     * @param statements the statements
     * @param position the position
     */
    public SubgraphStatement {
        statements = List.copyOf(statements);
    }
}
