package com.falkordb.dot;

import com.falkordb.dot.parser.AttributeList;
import com.falkordb.dot.statement.CreateEdge;
import com.falkordb.dot.statement.CreateNode;
import com.falkordb.dot.statement.GraphStatement;

import java.util.List;

/**
 * Output of one conversion: the ordered statements plus graph metadata.
 *
 * @param graphName the DOT graph name, or null if anonymous
 * @param directed whether the document was a {@code digraph}
 * @param strict whether the document was declared {@code strict}
 * @param graphAttributes attributes set on the graph itself
 * @param statements the statements, nodes first
 */
public record ConversionResult(String graphName, boolean directed,
        boolean strict, AttributeList graphAttributes,
        List<GraphStatement> statements) {

    /**
     * Copies the statements.
     *
     * @param graphName the graph name
     * @param directed the directedness flag
     * @param strict the strict flag
     * @param graphAttributes the graph attributes
     * @param statements the statements
     */
    public ConversionResult {
        statements = List.copyOf(statements);
    }

    /**
     * Get the node creation statements in order.
     *
     * @return the {@link CreateNode} statements
     */
    public List<CreateNode> nodes() {
        return statements.stream()
            .filter(CreateNode.class::isInstance)
            .map(CreateNode.class::cast)
            .toList();
    }

    /**
     * Get the relationship creation statements in order.
     *
     * @return the {@link CreateEdge} statements
     */
    public List<CreateEdge> edges() {
        return statements.stream()
            .filter(CreateEdge.class::isInstance)
            .map(CreateEdge.class::cast)
            .toList();
    }
}
