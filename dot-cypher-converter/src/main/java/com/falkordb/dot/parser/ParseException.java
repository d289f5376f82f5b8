package com.falkordb.dot.parser;

import com.falkordb.dot.DotConversionException;
import com.falkordb.dot.SourcePosition;

/**
 * Thrown when the token stream does not follow the DOT grammar.
 */
public class ParseException extends DotConversionException {

    /** Serialization version. */
    private static final long serialVersionUID = 1L;

    /** Message used when an edge operator contradicts the graph keyword. */
    public static final String OPERATOR_MISMATCH =
        "edge operator mismatch with graph directedness";

    /** The construct the parser expected at the position. */
    private final String expected;

    /**
     * Constructs a new ParseException.
     *
     * @param position where parsing failed
     * @param expected the construct that was expected
     * @param message the detail message
     */
    public ParseException(final SourcePosition position, final String expected,
            final String message) {
        super(position, message);
        this.expected = expected;
    }

    /**
     * Get the construct the parser expected.
     *
     * @return the expected construct
     */
    public String getExpected() {
        return expected;
    }
}
