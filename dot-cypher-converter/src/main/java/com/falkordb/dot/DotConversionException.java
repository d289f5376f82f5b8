package com.falkordb.dot;

/**
 * Base class for every failure that aborts a DOT to Cypher conversion.
 *
 * <p>A conversion either produces the complete statement sequence or throws
 * one of the subclasses; there is no partial result. When the failure can be
 * traced back to the input, {@link #getPosition()} returns the line and
 * column of the offending token and the message is prefixed with it.</p>
 */
public abstract class DotConversionException extends Exception {

    /** Serialization version. */
    private static final long serialVersionUID = 1L;

    /** Where the failure was detected, or null when unknown. */
    private final transient SourcePosition position;

    /**
     * Constructs a new conversion exception.
     *
     * @param position the source position, may be null
     * @param message the detail message without position prefix
     */
    protected DotConversionException(final SourcePosition position,
            final String message) {
        super(position == null ? message : position + ": " + message);
        this.position = position;
    }

    /**
     * Get the source position of the failure.
     *
     * @return the position, or null when the failure has no location
     */
    public SourcePosition getPosition() {
        return position;
    }
}
