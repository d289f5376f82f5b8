package com.falkordb.dot.resolve;

import java.util.List;

/**
 * The canonical graph after label resolution and value coercion.
 *
 * @param name the graph name, or null if anonymous
 * @param directed whether the document was a {@code digraph}
 * @param nodes resolved nodes in first-appearance order
 * @param edges resolved edges in declaration order
 */
public record ResolvedGraph(String name, boolean directed,
        List<ResolvedNode> nodes, List<ResolvedEdge> edges) {

    /**
     * Copies the lists.
     *
     * @param name the name
     * @param directed the directedness flag
     * @param nodes the nodes
     * @param edges the edges
     */
    public ResolvedGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
