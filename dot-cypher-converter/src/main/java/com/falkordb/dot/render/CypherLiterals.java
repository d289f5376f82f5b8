package com.falkordb.dot.render;

import com.falkordb.dot.resolve.TypedProperty;

import java.util.regex.Pattern;

/**
 * Cypher quoting helpers.
 */
final class CypherLiterals {

    /** Names that can be written without backticks. */
    private static final Pattern PLAIN_NAME =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private CypherLiterals() {
        throw new AssertionError("No instances");
    }

    /**
     * Quote a label, relationship type or property key when needed.
     *
     * @param name the name
     * @return the name, backtick-quoted unless it is a plain identifier
     */
    static String name(final String name) {
        if (PLAIN_NAME.matcher(name).matches()) {
            return name;
        }
        return "`" + name.replace("`", "``") + "`";
    }

    /**
     * Render a string as a single-quoted Cypher literal.
     *
     * @param value the string
     * @return the literal
     */
    static String string(final String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /**
     * Render a typed value with the literal syntax of its kind.
     *
     * @param property the property
     * @return the literal
     */
    static String value(final TypedProperty property) {
        return switch (property.kind()) {
            case STRING -> string((String) property.value());
            case INTEGER, FLOAT, BOOLEAN -> property.value().toString();
        };
    }
}
