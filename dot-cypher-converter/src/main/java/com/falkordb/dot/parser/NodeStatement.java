package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

/**
 * Declares a node, optionally with attributes.
 *
 * <p>A comma-separated node list such as {@code A, B [color=red]} is parsed
 * into one node statement per identifier, all sharing the same
 * attributes.</p>
 *
 * @param identifier the DOT node identifier
 * @param attributes the merged attribute lists of the statement
 * @param position where the identifier appears
 */
public record NodeStatement(String identifier, AttributeList attributes,
        SourcePosition position) implements DotStatement {
}
