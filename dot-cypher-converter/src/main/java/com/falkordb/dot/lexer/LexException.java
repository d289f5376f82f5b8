package com.falkordb.dot.lexer;

import com.falkordb.dot.DotConversionException;
import com.falkordb.dot.SourcePosition;

/**
 * Thrown when DOT text contains a character sequence that is not a token.
 */
public class LexException extends DotConversionException {

    /** Serialization version. */
    private static final long serialVersionUID = 1L;

    /** The offending character, or -1 at end of input. */
    private final int unexpected;

    /**
     * Constructs a new LexException.
     *
     * @param position where the problem was found
     * @param unexpected the offending code point, or -1 at end of input
     * @param message the detail message
     */
    public LexException(final SourcePosition position, final int unexpected,
            final String message) {
        super(position, message);
        this.unexpected = unexpected;
    }

    /**
     * Get the offending character.
     *
     * @return the code point, or -1 if the input ended unexpectedly
     */
    public int getUnexpected() {
        return unexpected;
    }
}
