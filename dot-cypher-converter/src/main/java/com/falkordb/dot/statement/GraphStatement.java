package com.falkordb.dot.statement;

import com.falkordb.dot.resolve.TypedProperty;

import java.util.List;

/**
 * One abstract graph-mutation instruction.
 *
 * <p>Statements refer to nodes by DOT identifier only; how a renderer turns
 * an identifier into a variable or a lookup pattern is up to the
 * renderer.</p>
 */
public sealed interface GraphStatement permits CreateNode, CreateEdge {

    /**
     * Get the typed properties to set.
     *
     * @return the properties
     */
    List<TypedProperty> properties();
}
