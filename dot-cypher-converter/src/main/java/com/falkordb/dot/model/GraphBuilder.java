package com.falkordb.dot.model;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.parser.AttributeList;
import com.falkordb.dot.parser.AttributeStatement;
import com.falkordb.dot.parser.DotStatement;
import com.falkordb.dot.parser.EdgeOperand;
import com.falkordb.dot.parser.EdgeStatement;
import com.falkordb.dot.parser.GraphDocument;
import com.falkordb.dot.parser.NodeReference;
import com.falkordb.dot.parser.NodeStatement;
import com.falkordb.dot.parser.SubgraphStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a syntax tree into a {@link CanonicalGraph}.
 *
 * <p>Statements are visited in declaration order. Node statements merge
 * their attributes into the node's single record. Edge endpoints that were
 * never declared get an empty record on first use. Subgraph bodies are
 * flattened in place; a subgraph used as an edge operand stands for every
 * node it mentions, so {@code a -> {b c}} yields {@code a -> b} and
 * {@code a -> c}. Edges are never merged.</p>
 *
 * <p>{@code node [...]} and {@code edge [...]} set defaults for the nodes
 * and edges created after them in the same block and in the subgraphs it
 * contains; a subgraph's own defaults end with the subgraph. Defaults are
 * applied once, when a node is first created, and explicit attributes are
 * merged over them. {@code graph [...]} and {@code name = value}
 * statements become graph attributes.</p>
 */
public final class GraphBuilder {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GraphBuilder.class);

    /** Node arena of the graph being built. */
    private final NodeRegistry registry = new NodeRegistry();

    /** Edges in declaration order. */
    private final List<EdgeRecord> edges = new ArrayList<>();

    /** Accumulated graph attributes. */
    private AttributeList graphAttributes = AttributeList.EMPTY;

    /** Directedness of the document being built. */
    private boolean directed;

    /** Set once {@link #build(GraphDocument)} ran. */
    private boolean used;

    /**
     * Build the canonical graph of a document.
     *
     * <p>A builder is single-use; create one per document.</p>
     *
     * @param document the parsed document
     * @return the canonical graph
     * @throws BuildException if an edge refers to a node handle that does
     *         not resolve to its identifier
     */
    public CanonicalGraph build(final GraphDocument document)
            throws BuildException {
        if (used) {
            throw new IllegalStateException("GraphBuilder has already been used");
        }
        used = true;
        directed = document.directed();

        visit(document.statements(), new Defaults());
        verify();

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built canonical graph: {} nodes, {} edges",
                registry.size(), edges.size());
        }
        return new CanonicalGraph(document.name(), document.directed(),
            document.strict(), graphAttributes, registry.records(), edges);
    }

    /**
     * Visit statements and report the identifiers they mention.
     */
    private Set<String> visit(final List<DotStatement> statements,
            final Defaults defaults) {
        Set<String> mentioned = new LinkedHashSet<>();
        for (DotStatement statement : statements) {
            if (statement instanceof NodeStatement node) {
                node(node.identifier(), node.position(), defaults)
                    .merge(node.attributes());
                mentioned.add(node.identifier());
            } else if (statement instanceof EdgeStatement edge) {
                mentioned.addAll(visitEdge(edge, defaults));
            } else if (statement instanceof SubgraphStatement subgraph) {
                mentioned.addAll(visit(subgraph.statements(), defaults.copy()));
            } else if (statement instanceof AttributeStatement attr) {
                visitAttributes(attr, defaults);
            }
        }
        return mentioned;
    }

    private Set<String> visitEdge(final EdgeStatement edge,
            final Defaults defaults) {
        List<List<NodeRecord>> groups = new ArrayList<>();
        Set<String> mentioned = new LinkedHashSet<>();
        for (EdgeOperand operand : edge.operands()) {
            List<NodeRecord> group = new ArrayList<>();
            if (operand instanceof NodeReference ref) {
                group.add(node(ref.identifier(), ref.position(), defaults));
            } else if (operand instanceof SubgraphStatement subgraph) {
                for (String id : visit(subgraph.statements(), defaults.copy())) {
                    group.add(registry.find(id));
                }
            }
            for (NodeRecord record : group) {
                mentioned.add(record.getIdentifier());
            }
            groups.add(group);
        }

        AttributeList attributes = defaults.edge.merge(edge.attributes());
        for (int i = 0; i + 1 < groups.size(); i++) {
            for (NodeRecord source : groups.get(i)) {
                for (NodeRecord target : groups.get(i + 1)) {
                    edges.add(new EdgeRecord(
                        source.getIdentifier(), source.getHandle(),
                        target.getIdentifier(), target.getHandle(),
                        directed, attributes, edge.position()));
                }
            }
        }
        return mentioned;
    }

    /**
     * Look up a node, creating it with the current node defaults on first
     * sight.
     */
    private NodeRecord node(final String identifier,
            final SourcePosition position, final Defaults defaults) {
        NodeRecord record = registry.find(identifier);
        if (record == null) {
            record = registry.getOrCreate(identifier, position);
            record.merge(defaults.node);
        }
        return record;
    }

    private void visitAttributes(final AttributeStatement statement,
            final Defaults defaults) {
        switch (statement.target()) {
            case GRAPH -> graphAttributes =
                graphAttributes.merge(statement.attributes());
            case NODE -> defaults.node =
                defaults.node.merge(statement.attributes());
            case EDGE -> defaults.edge =
                defaults.edge.merge(statement.attributes());
            default -> throw new IllegalStateException(
                "Unknown attribute target " + statement.target());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} attributes at {}: {}", statement.target(),
                statement.position(), statement.attributes());
        }
    }

    private void verify() throws BuildException {
        for (EdgeRecord edge : edges) {
            check(edge.source(), edge.sourceHandle(), edge);
            check(edge.target(), edge.targetHandle(), edge);
        }
    }

    private void check(final String identifier, final int handle,
            final EdgeRecord edge) throws BuildException {
        NodeRecord record = registry.get(handle);
        if (record == null || !record.getIdentifier().equals(identifier)) {
            throw new BuildException(identifier, edge.position(),
                "Edge endpoint handle " + handle + " does not resolve");
        }
    }

    /**
     * Node and edge defaults in effect for one block.
     */
    private static final class Defaults {
        /** Attributes given to nodes created in this block. */
        private AttributeList node = AttributeList.EMPTY;
        /** Attributes given to edges declared in this block. */
        private AttributeList edge = AttributeList.EMPTY;

        /**
         * Start a nested block that inherits the current defaults.
         */
        Defaults copy() {
            Defaults nested = new Defaults();
            nested.node = node;
            nested.edge = edge;
            return nested;
        }
    }
}
