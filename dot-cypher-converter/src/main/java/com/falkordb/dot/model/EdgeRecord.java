package com.falkordb.dot.model;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.parser.AttributeList;

/**
 * One edge of the canonical graph. Parallel edges are separate records.
 *
 * @param source the source node identifier
 * @param sourceHandle the source node's registry handle
 * @param target the target node identifier
 * @param targetHandle the target node's registry handle
 * @param directed whether the document was a {@code digraph}
 * @param attributes the edge's own attributes
 * @param position where the edge statement starts
 */
public record EdgeRecord(String source, int sourceHandle, String target,
        int targetHandle, boolean directed, AttributeList attributes,
        SourcePosition position) {
}
