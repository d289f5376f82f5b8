package com.falkordb.dot;

import com.falkordb.dot.lexer.DotLexer;
import com.falkordb.dot.lexer.LexException;
import com.falkordb.dot.lexer.Token;
import com.falkordb.dot.model.CanonicalGraph;
import com.falkordb.dot.model.GraphBuilder;
import com.falkordb.dot.parser.DotParser;
import com.falkordb.dot.parser.GraphDocument;
import com.falkordb.dot.resolve.AttributeResolver;
import com.falkordb.dot.resolve.ResolvedGraph;
import com.falkordb.dot.statement.GraphStatement;
import com.falkordb.dot.statement.StatementEmitter;
import com.falkordb.dot.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Converts DOT graph descriptions into Cypher graph-mutation statements.
 *
 * <p>The conversion is a straight pipeline:</p>
 * <ol>
 *   <li>{@link DotLexer} splits the text into tokens</li>
 *   <li>{@link DotParser} builds the syntax tree and checks that edge
 *       operators match {@code graph}/{@code digraph}</li>
 *   <li>{@link GraphBuilder} deduplicates nodes and collects edges</li>
 *   <li>{@link AttributeResolver} resolves labels and types values</li>
 *   <li>{@link StatementEmitter} orders the result into statements</li>
 * </ol>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * // DOT:
 * // digraph G {
 * //   A [label="Person", name="John"]
 * //   B [label="Company", name="Acme"]
 * //   A -> B [label="WORKS_AT", role="Developer"]
 * // }
 *
 * // Statements:
 * // CreateNode{A, [Person], {name: "John"}}
 * // CreateNode{B, [Company], {name: "Acme"}}
 * // CreateEdge{A -> B, WORKS_AT, {role: "Developer"}}
 * }</pre>
 *
 * <p>A converter holds only immutable settings and may be shared between
 * threads; each call works on its own state. A failure in any stage aborts
 * the call with a {@link DotConversionException} and no output.</p>
 */
public final class DotToCypherConverter {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        DotToCypherConverter.class);

    /** Attribute key for the input size in characters. */
    private static final AttributeKey<Long> ATTR_INPUT_LENGTH =
        AttributeKey.longKey("dot.input.length");

    /** Attribute key for the graph name. */
    private static final AttributeKey<String> ATTR_GRAPH_NAME =
        AttributeKey.stringKey("dot.graph.name");

    /** Attribute key for directedness. */
    private static final AttributeKey<Boolean> ATTR_DIRECTED =
        AttributeKey.booleanKey("dot.graph.directed");

    /** Attribute key for the token count. */
    private static final AttributeKey<Long> ATTR_TOKEN_COUNT =
        AttributeKey.longKey("dot.token_count");

    /** Attribute key for the node count. */
    private static final AttributeKey<Long> ATTR_NODE_COUNT =
        AttributeKey.longKey("dot.node_count");

    /** Attribute key for the edge count. */
    private static final AttributeKey<Long> ATTR_EDGE_COUNT =
        AttributeKey.longKey("dot.edge_count");

    /** Attribute key for the statement count. */
    private static final AttributeKey<Long> ATTR_STATEMENT_COUNT =
        AttributeKey.longKey("cypher.statement_count");

    /** Conversion settings. */
    private final ConversionOptions options;

    /** Tracer for conversion spans. */
    private final Tracer tracer;

    /**
     * Create a converter with default options.
     */
    public DotToCypherConverter() {
        this(ConversionOptions.defaults());
    }

    /**
     * Create a converter with the given options, traced through
     * {@link TracingUtil}.
     *
     * @param options the conversion options
     */
    public DotToCypherConverter(final ConversionOptions options) {
        this(options, TracingUtil.getTracer(TracingUtil.SCOPE_CONVERTER));
    }

    /**
     * Create a converter with the given options and tracer.
     *
     * @param options the conversion options
     * @param tracer the tracer for conversion spans
     */
    public DotToCypherConverter(final ConversionOptions options,
            final Tracer tracer) {
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("Tracer cannot be null");
        }
        this.options = options;
        this.tracer = tracer;
    }

    /**
     * Get the settings of this converter.
     *
     * @return the options
     */
    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * Convert DOT text into statements.
     *
     * @param dot the DOT text
     * @return the statements with graph metadata
     * @throws LexException if the text cannot be tokenized or is too large
     * @throws DotConversionException if any later stage fails
     */
    public ConversionResult convert(final String dot)
            throws DotConversionException {
        if (dot == null) {
            throw new IllegalArgumentException("DOT input cannot be null");
        }

        Span span = tracer.spanBuilder("DotToCypherConverter.convert")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_INPUT_LENGTH, (long) dot.length())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            ConversionResult result = convertInternal(dot, span);
            span.setAttribute(ATTR_STATEMENT_COUNT,
                (long) result.statements().size());
            span.setStatus(StatusCode.OK);
            return result;
        } catch (DotConversionException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Conversion failed: {}", e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Run the pipeline without the outer span.
     */
    private ConversionResult convertInternal(final String dot,
            final Span span) throws DotConversionException {
        if (dot.length() > options.getMaxInputSize()) {
            throw new LexException(null, -1, "Input of " + dot.length()
                + " characters exceeds the maximum of "
                + options.getMaxInputSize());
        }

        List<Token> tokens = stage("lex",
            () -> new DotLexer(dot).tokenize());
        span.setAttribute(ATTR_TOKEN_COUNT, (long) tokens.size());

        GraphDocument document = stage("parse",
            () -> new DotParser(tokens, options.getMaxNestingDepth()).parse());
        span.setAttribute(ATTR_DIRECTED, document.directed());
        if (document.name() != null) {
            span.setAttribute(ATTR_GRAPH_NAME, document.name());
        }

        CanonicalGraph graph = stage("build",
            () -> new GraphBuilder().build(document));
        span.setAttribute(ATTR_NODE_COUNT, (long) graph.nodes().size());
        span.setAttribute(ATTR_EDGE_COUNT, (long) graph.edges().size());

        AttributeResolver resolver = new AttributeResolver(
            options.getDefaultRelationshipType());
        ResolvedGraph resolved = stage("resolve",
            () -> resolver.resolve(graph));

        List<GraphStatement> statements = stage("emit",
            () -> new StatementEmitter().emit(resolved));

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Converted {} '{}': {} nodes, {} edges, {} statements",
                graph.directed() ? "digraph" : "graph", graph.name(),
                graph.nodes().size(), graph.edges().size(), statements.size());
        }
        return new ConversionResult(graph.name(), graph.directed(),
            graph.strict(), graph.graphAttributes(), statements);
    }

    /**
     * Run one pipeline stage inside a child span.
     */
    private <T> T stage(final String name, final Stage<T> work)
            throws DotConversionException {
        Span span = tracer.spanBuilder("DotToCypherConverter." + name)
            .setSpanKind(SpanKind.INTERNAL)
            .startSpan();
        try (Scope scope = span.makeCurrent()) {
            T result = work.run();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (DotConversionException | RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * A pipeline stage that may fail with a conversion error.
     *
     * @param <T> the stage output
     */
    @FunctionalInterface
    private interface Stage<T> {
        T run() throws DotConversionException;
    }
}
