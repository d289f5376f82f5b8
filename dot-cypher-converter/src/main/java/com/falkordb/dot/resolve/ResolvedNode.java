package com.falkordb.dot.resolve;

import java.util.List;

/**
 * A node with its labels and typed properties.
 *
 * @param identifier the DOT identifier
 * @param labels zero or more labels, in the order written
 * @param properties typed properties in attribute order
 */
public record ResolvedNode(String identifier, List<String> labels,
        List<TypedProperty> properties) {

    /**
     * Copies the lists.
     *
     * @param identifier the identifier
     * @param labels the labels
     * @param properties the properties
     */
    public ResolvedNode {
        labels = List.copyOf(labels);
        properties = List.copyOf(properties);
    }
}
