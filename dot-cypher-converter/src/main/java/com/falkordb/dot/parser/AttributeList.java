package com.falkordb.dot.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw DOT attributes of one statement: unique names mapped to unparsed
 * string values.
 *
 * <p>Instances are immutable. When several bracketed lists follow one
 * statement they are combined with {@link #merge(AttributeList)}, so the
 * last value written for a name wins. Iteration follows the order in which
 * a name was first written.</p>
 */
public final class AttributeList {

    /** The shared empty list. */
    public static final AttributeList EMPTY = new AttributeList(Map.of());

    /** Attribute values by name. */
    private final Map<String, String> values;

    private AttributeList(final Map<String, String> values) {
        this.values = values;
    }

    /**
     * Create an attribute list from name/value pairs.
     *
     * @param values the attributes; later entries of an ordered map win
     * @return the attribute list
     */
    public static AttributeList of(final Map<String, String> values) {
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new AttributeList(
            Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Combine this list with a later one; the later list wins on collisions.
     *
     * @param later the list written after this one
     * @return the merged list
     */
    public AttributeList merge(final AttributeList later) {
        if (later.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return later;
        }
        Map<String, String> merged = new LinkedHashMap<>(values);
        merged.putAll(later.values);
        return new AttributeList(Collections.unmodifiableMap(merged));
    }

    /**
     * Look up a raw value.
     *
     * @param name the attribute name
     * @return the value, or null if absent
     */
    public String get(final String name) {
        return values.get(name);
    }

    /**
     * Check whether an attribute is present.
     *
     * @param name the attribute name
     * @return true if present
     */
    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    /**
     * Check for an empty list.
     *
     * @return true if there are no attributes
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Get the number of attributes.
     *
     * @return the attribute count
     */
    public int size() {
        return values.size();
    }

    /**
     * Read-only view of the attributes in insertion order.
     *
     * @return the attributes by name
     */
    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof AttributeList other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
