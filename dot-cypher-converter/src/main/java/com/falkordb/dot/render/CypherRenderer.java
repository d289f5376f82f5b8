package com.falkordb.dot.render;

import com.falkordb.dot.resolve.TypedProperty;
import com.falkordb.dot.statement.CreateEdge;
import com.falkordb.dot.statement.CreateNode;
import com.falkordb.dot.statement.GraphStatement;
import com.falkordb.dot.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders statements as Cypher text.
 *
 * <p>Every node is written with an id property (default
 * {@value #DEFAULT_ID_PROPERTY}) holding its DOT identifier, so that
 * statements executed one at a time can find the node again. Literal syntax
 * follows the typed property kind: strings are single-quoted, numbers and
 * booleans are written bare. Labels, relationship types and keys that are
 * not plain identifiers are backtick-quoted.</p>
 *
 * <h2>{@link RenderMode#STATEMENTS} (default):</h2>
 * <pre>{@code
 * CREATE (:Person {dotId: 'A', name: 'John'})
 * CREATE (:Company {dotId: 'B', name: 'Acme'})
 * MATCH (a {dotId: 'A'}), (b {dotId: 'B'})
 * CREATE (a)-[:WORKS_AT {role: 'Developer'}]->(b)
 * }</pre>
 *
 * <h2>{@link RenderMode#SCRIPT}:</h2>
 * <pre>{@code
 * CREATE (n0:Person {dotId: 'A', name: 'John'})
 * CREATE (n1:Company {dotId: 'B', name: 'Acme'})
 * CREATE (n0)-[:WORKS_AT {role: 'Developer'}]->(n1)
 * }</pre>
 *
 * <p>With {@link Builder#parameterized(boolean)} property values become
 * {@code $p0, $p1, ...} placeholders and are returned in
 * {@link RenderedQuery#parameters()}. Instances are immutable and
 * thread-safe.</p>
 */
public final class CypherRenderer {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        CypherRenderer.class);

    /** Default property that stores the DOT identifier. */
    public static final String DEFAULT_ID_PROPERTY = "dotId";

    /** Separator between queries in a script. */
    private static final String QUERY_SEPARATOR = ";\n";

    /** Valid id property names. */
    private static final Pattern ID_PROPERTY =
        Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Attribute key for the render mode. */
    private static final AttributeKey<String> ATTR_MODE =
        AttributeKey.stringKey("cypher.render.mode");

    /** Attribute key for the input statement count. */
    private static final AttributeKey<Long> ATTR_STATEMENT_COUNT =
        AttributeKey.longKey("cypher.statement_count");

    /** Attribute key for the output query count. */
    private static final AttributeKey<Long> ATTR_QUERY_COUNT =
        AttributeKey.longKey("cypher.query_count");

    /** Layout of the output. */
    private final RenderMode mode;

    /** Property holding the DOT identifier. */
    private final String idProperty;

    /** Whether values become parameters. */
    private final boolean parameterized;

    /** Tracer for render spans. */
    private final Tracer tracer;

    private CypherRenderer(final Builder builder) {
        this.mode = builder.mode;
        this.idProperty = builder.idProperty;
        this.parameterized = builder.parameterized;
        this.tracer = builder.tracer != null ? builder.tracer
            : TracingUtil.getTracer(TracingUtil.SCOPE_RENDERER);
    }

    /**
     * Obtain a {@link Builder} to configure a renderer.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the layout of the output.
     *
     * @return the render mode
     */
    public RenderMode getMode() {
        return mode;
    }

    /**
     * Get the property that stores DOT identifiers.
     *
     * @return the id property name
     */
    public String getIdProperty() {
        return idProperty;
    }

    /**
     * Render statements to queries.
     *
     * @param statements statements in emission order
     * @return one query per statement in {@link RenderMode#STATEMENTS}
     *         mode, a single query in {@link RenderMode#SCRIPT} mode (none
     *         when there are no statements)
     * @throws IllegalArgumentException in {@link RenderMode#SCRIPT} mode, if
     *         an edge refers to a node not created earlier in the list
     */
    public List<RenderedQuery> render(
            final List<? extends GraphStatement> statements) {
        Span span = tracer.spanBuilder("CypherRenderer.render")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_MODE, mode.name())
            .setAttribute(ATTR_STATEMENT_COUNT, (long) statements.size())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            List<RenderedQuery> queries = mode == RenderMode.SCRIPT
                ? renderScriptMode(statements)
                : renderStatementsMode(statements);
            span.setAttribute(ATTR_QUERY_COUNT, (long) queries.size());
            span.setStatus(StatusCode.OK);
            return queries;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Render statements to one script, queries separated by {@code ;} and a
     * newline and terminated by {@code ;}.
     *
     * @param statements statements in emission order
     * @return the script, empty when there are no statements
     * @throws IllegalStateException if the renderer is parameterized, since
     *         a script cannot carry parameter values
     */
    public String renderScript(final List<? extends GraphStatement> statements) {
        if (parameterized) {
            throw new IllegalStateException(
                "A parameterized renderer cannot produce a plain script");
        }
        List<RenderedQuery> queries = render(statements);
        if (queries.isEmpty()) {
            return "";
        }
        StringJoiner script = new StringJoiner(QUERY_SEPARATOR, "", ";");
        for (RenderedQuery query : queries) {
            script.add(query.cypher());
        }
        return script.toString();
    }

    private List<RenderedQuery> renderStatementsMode(
            final List<? extends GraphStatement> statements) {
        List<RenderedQuery> queries = new ArrayList<>(statements.size());
        for (GraphStatement statement : statements) {
            Params params = new Params();
            StringBuilder cypher = new StringBuilder();
            if (statement instanceof CreateNode node) {
                cypher.append("CREATE ");
                appendNode(cypher, "", node, params);
            } else if (statement instanceof CreateEdge edge) {
                cypher.append("MATCH (a {")
                    .append(CypherLiterals.name(idProperty)).append(": ")
                    .append(params.string(edge.source()))
                    .append("}), (b {")
                    .append(CypherLiterals.name(idProperty)).append(": ")
                    .append(params.string(edge.target()))
                    .append("})\nCREATE ");
                appendRelationship(cypher, "a", "b", edge, params);
            }
            queries.add(new RenderedQuery(cypher.toString(), params.values));
        }
        return queries;
    }

    private List<RenderedQuery> renderScriptMode(
            final List<? extends GraphStatement> statements) {
        if (statements.isEmpty()) {
            return List.of();
        }
        Map<String, String> variables = new HashMap<>();
        Params params = new Params();
        StringJoiner cypher = new StringJoiner("\n");
        for (GraphStatement statement : statements) {
            StringBuilder clause = new StringBuilder("CREATE ");
            if (statement instanceof CreateNode node) {
                String variable = variables.get(node.identifier());
                if (variable != null) {
                    throw new IllegalArgumentException(
                        "Node '" + node.identifier() + "' is created twice");
                }
                variable = "n" + variables.size();
                variables.put(node.identifier(), variable);
                appendNode(clause, variable, node, params);
            } else if (statement instanceof CreateEdge edge) {
                appendRelationship(clause,
                    variable(variables, edge.source()),
                    variable(variables, edge.target()), edge, params);
            }
            cypher.add(clause);
        }
        return List.of(new RenderedQuery(cypher.toString(), params.values));
    }

    private static String variable(final Map<String, String> variables,
            final String identifier) {
        String variable = variables.get(identifier);
        if (variable == null) {
            throw new IllegalArgumentException("Relationship refers to node '"
                + identifier + "' which is not created earlier in the script");
        }
        return variable;
    }

    private void appendNode(final StringBuilder cypher, final String variable,
            final CreateNode node, final Params params) {
        cypher.append('(').append(variable);
        for (String label : node.labels()) {
            cypher.append(':').append(CypherLiterals.name(label));
        }
        Map<String, String> map = new LinkedHashMap<>();
        map.put(CypherLiterals.name(idProperty),
            params.string(node.identifier()));
        for (TypedProperty property : node.properties()) {
            if (property.name().equals(idProperty)) {
                if (LOGGER.isWarnEnabled()) {
                    LOGGER.warn("Attribute '{}' of node '{}' is replaced by "
                        + "the node identifier", idProperty, node.identifier());
                }
                continue;
            }
            map.put(CypherLiterals.name(property.name()), params.value(property));
        }
        if (!variable.isEmpty() || !node.labels().isEmpty()) {
            cypher.append(' ');
        }
        appendMap(cypher, map);
        cypher.append(')');
    }

    private void appendRelationship(final StringBuilder cypher,
            final String from, final String to, final CreateEdge edge,
            final Params params) {
        cypher.append('(').append(from).append(")-[:")
            .append(CypherLiterals.name(edge.relationshipType()));
        if (!edge.properties().isEmpty()) {
            Map<String, String> map = new LinkedHashMap<>();
            for (TypedProperty property : edge.properties()) {
                map.put(CypherLiterals.name(property.name()),
                    params.value(property));
            }
            cypher.append(' ');
            appendMap(cypher, map);
        }
        cypher.append("]->(").append(to).append(')');
    }

    private static void appendMap(final StringBuilder cypher,
            final Map<String, String> map) {
        StringJoiner entries = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, String> entry : map.entrySet()) {
            entries.add(entry.getKey() + ": " + entry.getValue());
        }
        cypher.append(entries);
    }

    /**
     * Collects parameter values for one query, or renders literals when the
     * renderer is not parameterized.
     */
    private final class Params {
        /** Parameter values by name. */
        private final Map<String, Object> values = new LinkedHashMap<>();

        String string(final String value) {
            if (!parameterized) {
                return CypherLiterals.string(value);
            }
            return add(value);
        }

        String value(final TypedProperty property) {
            if (!parameterized) {
                return CypherLiterals.value(property);
            }
            return add(property.value());
        }

        private String add(final Object value) {
            String name = "p" + values.size();
            values.put(name, value);
            return "$" + name;
        }
    }

    /**
     * Builder for {@link CypherRenderer}.
     */
    public static class Builder {
        /** Layout of the output. */
        private RenderMode mode = RenderMode.STATEMENTS;
        /** Property holding the DOT identifier. */
        private String idProperty = DEFAULT_ID_PROPERTY;
        /** Whether values become parameters. */
        private boolean parameterized = false;
        /** Tracer for render spans, null for the shared one. */
        private Tracer tracer = null;

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the output layout.
         *
         * @param value the render mode
         * @return this builder
         */
        public Builder mode(final RenderMode value) {
            if (value == null) {
                throw new IllegalArgumentException("Mode cannot be null");
            }
            this.mode = value;
            return this;
        }

        /**
         * Set the property that stores DOT identifiers.
         *
         * @param value a plain identifier such as {@code dotId}
         * @return this builder
         */
        public Builder idProperty(final String value) {
            if (value == null || !ID_PROPERTY.matcher(value).matches()) {
                throw new IllegalArgumentException(
                    "Id property must be a plain identifier: " + value);
            }
            this.idProperty = value;
            return this;
        }

        /**
         * Render values as parameters instead of inline literals.
         *
         * @param value true to use parameters
         * @return this builder
         */
        public Builder parameterized(final boolean value) {
            this.parameterized = value;
            return this;
        }

        /**
         * Use a specific tracer instead of the shared one.
         *
         * @param value the tracer
         * @return this builder
         */
        public Builder tracer(final Tracer value) {
            this.tracer = value;
            return this;
        }

        /**
         * Build the renderer.
         *
         * @return the configured renderer
         */
        public CypherRenderer build() {
            return new CypherRenderer(this);
        }
    }
}
