package com.falkordb.dot.render;

/**
 * How {@link CypherRenderer} lays out statements.
 */
public enum RenderMode {
    /**
     * One self-contained query per statement. Relationships find their
     * endpoints with a {@code MATCH} on the id property.
     */
    STATEMENTS,
    /**
     * A single query in which nodes are bound to variables and
     * relationships reference those variables inline.
     */
    SCRIPT
}
