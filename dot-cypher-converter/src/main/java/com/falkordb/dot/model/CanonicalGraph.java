package com.falkordb.dot.model;

import com.falkordb.dot.parser.AttributeList;

import java.util.List;

/**
 * Deduplicated nodes and ordered edges of one DOT document.
 *
 * @param name the graph name, or null if anonymous
 * @param directed whether the document was a {@code digraph}
 * @param strict whether the document was declared {@code strict}
 * @param graphAttributes attributes set on the graph itself
 * @param nodes node records in first-appearance order; the index of each
 *        record equals its handle
 * @param edges edge records in declaration order
 */
public record CanonicalGraph(String name, boolean directed, boolean strict,
        AttributeList graphAttributes, List<NodeRecord> nodes,
        List<EdgeRecord> edges) {

    /**
     * Copies the lists.
     *
     * @param name the name
     * @param directed the directedness flag
     * @param strict the strict flag
     * @param graphAttributes the graph attributes
     * @param nodes the nodes
     * @param edges the edges
     */
    public CanonicalGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * Resolve a node handle.
     *
     * @param handle the handle
     * @return the record
     * @throws IndexOutOfBoundsException if the handle is not in this graph
     */
    public NodeRecord node(final int handle) {
        return nodes.get(handle);
    }
}
