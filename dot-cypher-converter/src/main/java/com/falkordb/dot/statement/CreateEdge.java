package com.falkordb.dot.statement;

import com.falkordb.dot.resolve.TypedProperty;

import java.util.List;

/**
 * Create a relationship between two nodes created earlier in the sequence.
 *
 * <p>Relationships in the target model always have a direction, so the
 * emitter sets {@code directed} on every statement it produces; an
 * undirected DOT edge arrives as two statements, one per direction.</p>
 *
 * @param source the DOT identifier of the start node
 * @param target the DOT identifier of the end node
 * @param relationshipType the relationship type
 * @param properties the typed properties
 * @param directed whether the relationship points from source to target
 */
public record CreateEdge(String source, String target,
        String relationshipType, List<TypedProperty> properties,
        boolean directed) implements GraphStatement {

    /**
     * Copies the properties.
     *
     * @param source the source
     * @param target the target
     * @param relationshipType the relationship type
     * @param properties the properties
     * @param directed the direction flag
     */
    public CreateEdge {
        properties = List.copyOf(properties);
    }
}
