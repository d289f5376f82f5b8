package com.falkordb.dot.resolve;

/**
 * The value types a DOT attribute can be coerced to.
 */
public enum PropertyKind {
    /** Java {@link String}. */
    STRING,
    /** Java {@link Long}. */
    INTEGER,
    /** Java {@link Double}, always finite. */
    FLOAT,
    /** Java {@link Boolean}. */
    BOOLEAN
}
