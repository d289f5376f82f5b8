package com.falkordb.dot.resolve;

import java.util.List;

/**
 * An edge with its relationship type and typed properties.
 *
 * @param source the source node identifier
 * @param target the target node identifier
 * @param directed whether the source document was a {@code digraph}
 * @param relationshipType the relationship type
 * @param properties typed properties in attribute order
 */
public record ResolvedEdge(String source, String target, boolean directed,
        String relationshipType, List<TypedProperty> properties) {

    /**
     * Copies the properties.
     *
     * @param source the source
     * @param target the target
     * @param directed the directedness flag
     * @param relationshipType the relationship type
     * @param properties the properties
     */
    public ResolvedEdge {
        properties = List.copyOf(properties);
    }
}
