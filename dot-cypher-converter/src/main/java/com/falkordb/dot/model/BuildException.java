package com.falkordb.dot.model;

import com.falkordb.dot.DotConversionException;
import com.falkordb.dot.SourcePosition;

/**
 * Thrown when the canonical graph would be internally inconsistent.
 *
 * <p>A document accepted by the parser never triggers this; it guards the
 * registry invariants.</p>
 */
public class BuildException extends DotConversionException {

    /** Serialization version. */
    private static final long serialVersionUID = 1L;

    /** The node identifier involved. */
    private final String identifier;

    /**
     * Constructs a new BuildException.
     *
     * @param identifier the node identifier involved
     * @param position the source position, may be null
     * @param reason what is inconsistent
     */
    public BuildException(final String identifier,
            final SourcePosition position, final String reason) {
        super(position, reason + " (node '" + identifier + "')");
        this.identifier = identifier;
    }

    /**
     * Get the node identifier involved.
     *
     * @return the identifier
     */
    public String getIdentifier() {
        return identifier;
    }
}
