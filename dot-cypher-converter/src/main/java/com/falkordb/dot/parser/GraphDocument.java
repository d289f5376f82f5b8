package com.falkordb.dot.parser;

import java.util.List;

/**
 * The syntax tree of one DOT graph.
 *
 * @param strict whether the graph was declared {@code strict}
 * @param directed true for {@code digraph}, false for {@code graph}
 * @param name the graph name, or null if anonymous
 * @param statements the top-level statements in source order
 */
public record GraphDocument(boolean strict, boolean directed, String name,
        List<DotStatement> statements) {

    /**
     * Copies the statements.
     *
     * @param strict the strict flag
     * @param directed the directedness flag
     * @param name the name
     * @param statements the statements
     */
    public GraphDocument {
        statements = List.copyOf(statements);
    }
}
