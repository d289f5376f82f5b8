package com.falkordb.dot.statement;

import com.falkordb.dot.resolve.ResolvedEdge;
import com.falkordb.dot.resolve.ResolvedGraph;
import com.falkordb.dot.resolve.ResolvedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders a resolved graph into statements.
 *
 * <p>All {@link CreateNode} statements come first, one per node in
 * first-appearance order. Then each edge in declaration order becomes one
 * {@link CreateEdge}, or two (source to target, then target to source) when
 * the graph is undirected.</p>
 */
public final class StatementEmitter {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        StatementEmitter.class);

    /**
     * Emit the statements for a resolved graph.
     *
     * @param graph the resolved graph
     * @return an immutable statement list
     */
    public List<GraphStatement> emit(final ResolvedGraph graph) {
        List<GraphStatement> statements = new ArrayList<>(
            graph.nodes().size() + 2 * graph.edges().size());

        for (ResolvedNode node : graph.nodes()) {
            statements.add(new CreateNode(node.identifier(), node.labels(),
                node.properties()));
        }

        for (ResolvedEdge edge : graph.edges()) {
            statements.add(new CreateEdge(edge.source(), edge.target(),
                edge.relationshipType(), edge.properties(), true));
            if (!edge.directed()) {
                statements.add(new CreateEdge(edge.target(), edge.source(),
                    edge.relationshipType(), edge.properties(), true));
            }
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Emitted {} statements for {} nodes and {} edges",
                statements.size(), graph.nodes().size(), graph.edges().size());
        }
        return List.copyOf(statements);
    }
}
