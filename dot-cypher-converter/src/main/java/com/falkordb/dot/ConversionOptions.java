package com.falkordb.dot;

import com.falkordb.dot.parser.DotParser;
import com.falkordb.dot.resolve.AttributeResolver;

/**
 * Immutable settings for {@link DotToCypherConverter}.
 */
public final class ConversionOptions {
    /** Default maximum input size in characters (10 MiB). */
    public static final int DEFAULT_MAX_INPUT_SIZE = 10 * 1024 * 1024;

    /** Relationship type for edges without a label. */
    private final String defaultRelationshipType;
    /** Largest accepted input, in characters. */
    private final int maxInputSize;
    /** Deepest accepted subgraph nesting. */
    private final int maxNestingDepth;

    private ConversionOptions(final Builder builder) {
        this.defaultRelationshipType = builder.defaultRelationshipType;
        this.maxInputSize = builder.maxInputSize;
        this.maxNestingDepth = builder.maxNestingDepth;
    }

    /**
     * Get the default options.
     *
     * @return options with every setting at its default
     */
    public static ConversionOptions defaults() {
        return builder().build();
    }

    /**
     * Obtain a {@link Builder} to configure conversion options.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the relationship type used for edges without a label.
     *
     * @return the default relationship type
     */
    public String getDefaultRelationshipType() {
        return defaultRelationshipType;
    }

    /**
     * Get the largest accepted input.
     *
     * @return the maximum input size in characters
     */
    public int getMaxInputSize() {
        return maxInputSize;
    }

    /**
     * Get the deepest accepted subgraph nesting.
     *
     * @return the maximum nesting depth
     */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    @Override
    public String toString() {
        return "ConversionOptions{defaultRelationshipType="
            + defaultRelationshipType + ", maxInputSize=" + maxInputSize
            + ", maxNestingDepth=" + maxNestingDepth + "}";
    }

    /**
     * Builder for {@link ConversionOptions}.
     */
    public static class Builder {
        /** Relationship type for edges without a label. */
        private String defaultRelationshipType =
            AttributeResolver.DEFAULT_RELATIONSHIP_TYPE;
        /** Largest accepted input, in characters. */
        private int maxInputSize = DEFAULT_MAX_INPUT_SIZE;
        /** Deepest accepted subgraph nesting. */
        private int maxNestingDepth = DotParser.DEFAULT_MAX_NESTING_DEPTH;

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the relationship type for edges without a label.
         *
         * @param value the relationship type, not blank
         * @return this builder
         */
        public Builder defaultRelationshipType(final String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(
                    "Default relationship type cannot be blank");
            }
            this.defaultRelationshipType = value.trim();
            return this;
        }

        /**
         * Set the largest accepted input.
         *
         * @param value the maximum size in characters, positive
         * @return this builder
         */
        public Builder maxInputSize(final int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(
                    "Maximum input size must be positive: " + value);
            }
            this.maxInputSize = value;
            return this;
        }

        /**
         * Set the deepest accepted subgraph nesting.
         *
         * @param value the maximum depth, zero to forbid subgraphs
         * @return this builder
         */
        public Builder maxNestingDepth(final int value) {
            if (value < 0) {
                throw new IllegalArgumentException(
                    "Maximum nesting depth cannot be negative: " + value);
            }
            this.maxNestingDepth = value;
            return this;
        }

        /**
         * Build the options.
         *
         * @return the configured options
         */
        public ConversionOptions build() {
            return new ConversionOptions(this);
        }
    }
}
