package com.falkordb.dot.statement;

import com.falkordb.dot.resolve.TypedProperty;

import java.util.List;

/**
 * Create a node.
 *
 * @param identifier the DOT identifier of the node
 * @param labels zero or more labels
 * @param properties the typed properties
 */
public record CreateNode(String identifier, List<String> labels,
        List<TypedProperty> properties) implements GraphStatement {

    /**
     * Copies the lists.
     *
     * @param identifier the identifier
     * @param labels the labels
     * @param properties the properties
     */
    public CreateNode {
        labels = List.copyOf(labels);
        properties = List.copyOf(properties);
    }
}
