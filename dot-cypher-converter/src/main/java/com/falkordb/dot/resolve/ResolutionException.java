package com.falkordb.dot.resolve;

import com.falkordb.dot.DotConversionException;
import com.falkordb.dot.SourcePosition;

/**
 * Thrown when a reserved attribute holds a value that cannot be used.
 */
public class ResolutionException extends DotConversionException {

    /** Serialization version. */
    private static final long serialVersionUID = 1L;

    /** The rejected raw value. */
    private final String value;

    /**
     * Constructs a new ResolutionException.
     *
     * @param value the rejected raw value
     * @param position where the owning statement starts, may be null
     * @param reason why the value was rejected
     */
    public ResolutionException(final String value,
            final SourcePosition position, final String reason) {
        super(position, reason + ": \"" + value + "\"");
        this.value = value;
    }

    /**
     * Get the rejected raw value.
     *
     * @return the value
     */
    public String getValue() {
        return value;
    }
}
