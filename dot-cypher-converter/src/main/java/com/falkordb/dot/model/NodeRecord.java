package com.falkordb.dot.model;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.parser.AttributeList;

/**
 * The single canonical record of a DOT node identifier.
 *
 * <p>The node defaults in effect at creation come first; attributes from
 * every statement that declares the node are then merged in declaration
 * order, a later value for the same name replacing the earlier one. Records
 * are created by {@link NodeRegistry} and filled by {@link GraphBuilder}.</p>
 */
public final class NodeRecord {

    /** The DOT identifier. */
    private final String identifier;

    /** Index of the record in its registry, i.e. first-appearance rank. */
    private final int handle;

    /** Where the identifier first appeared. */
    private final SourcePosition position;

    /** Merged attributes. */
    private AttributeList attributes = AttributeList.EMPTY;

    NodeRecord(final String identifier, final int handle,
            final SourcePosition position) {
        this.identifier = identifier;
        this.handle = handle;
        this.position = position;
    }

    void merge(final AttributeList later) {
        attributes = attributes.merge(later);
    }

    /**
     * Get the DOT identifier.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }

    /**
     * Get the registry handle, which is also the first-appearance rank.
     *
     * @return the handle
     */
    public int getHandle() {
        return handle;
    }

    /**
     * Get where the identifier first appeared.
     *
     * @return the position
     */
    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Get the merged attributes.
     *
     * @return the attributes
     */
    public AttributeList getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return "NodeRecord{" + identifier + "#" + handle + " " + attributes
            + "}";
    }
}
