package com.falkordb.dot.resolve;

import java.util.Objects;

/**
 * A property name with a value whose Java type matches its kind.
 *
 * @param name the property name
 * @param kind the value kind
 * @param value a {@link String}, {@link Long}, {@link Double} or
 *        {@link Boolean} according to {@code kind}
 */
public record TypedProperty(String name, PropertyKind kind, Object value) {

    /**
     * Validates that the value matches the kind.
     *
     * @param name the name
     * @param kind the kind
     * @param value the value
     */
    public TypedProperty {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        boolean matches = switch (kind) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Long;
            case FLOAT -> value instanceof Double d && Double.isFinite(d);
            case BOOLEAN -> value instanceof Boolean;
        };
        if (!matches) {
            throw new IllegalArgumentException("Value " + value
                + " does not match kind " + kind + " for property " + name);
        }
    }

    /**
     * Create a string property.
     *
     * @param name the name
     * @param value the value
     * @return the property
     */
    public static TypedProperty ofString(final String name,
            final String value) {
        return new TypedProperty(name, PropertyKind.STRING, value);
    }

    /**
     * Create an integer property.
     *
     * @param name the name
     * @param value the value
     * @return the property
     */
    public static TypedProperty ofInteger(final String name, final long value) {
        return new TypedProperty(name, PropertyKind.INTEGER, value);
    }

    /**
     * Create a float property.
     *
     * @param name the name
     * @param value the finite value
     * @return the property
     */
    public static TypedProperty ofFloat(final String name, final double value) {
        return new TypedProperty(name, PropertyKind.FLOAT, value);
    }

    /**
     * Create a boolean property.
     *
     * @param name the name
     * @param value the value
     * @return the property
     */
    public static TypedProperty ofBoolean(final String name,
            final boolean value) {
        return new TypedProperty(name, PropertyKind.BOOLEAN, value);
    }
}
