package com.falkordb.dot.render;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A Cypher query and the parameters it references.
 *
 * @param cypher the query text
 * @param parameters values for the {@code $name} placeholders in the order
 *        they appear in the query, empty when the query uses inline
 *        literals
 */
public record RenderedQuery(String cypher, Map<String, Object> parameters) {

    /**
     * Copies the parameters, keeping their order.
     *
     * @param cypher the query text
     * @param parameters the parameters
     */
    public RenderedQuery {
        parameters = Collections.unmodifiableMap(
            new LinkedHashMap<>(parameters));
    }
}
