package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

/**
 * A {@code graph [...]}, {@code node [...]} or {@code edge [...]} statement,
 * or a bare {@code name = value} graph attribute assignment.
 *
 * @param target which element kind the attributes apply to
 * @param attributes the attributes
 * @param position where the statement starts
 */
public record AttributeStatement(Target target, AttributeList attributes,
        SourcePosition position) implements DotStatement {

    /** The element kind an attribute statement addresses. */
    public enum Target {
        GRAPH,
        NODE,
        EDGE
    }
}
