package com.falkordb.dot.resolve;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.model.CanonicalGraph;
import com.falkordb.dot.model.EdgeRecord;
import com.falkordb.dot.model.NodeRecord;
import com.falkordb.dot.parser.AttributeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves the reserved {@code label} attribute and types every other
 * attribute value.
 *
 * <p>{@code label} means different things on nodes and edges, so the two
 * cases are separate operations:</p>
 * <ul>
 *   <li>{@link #resolveNodeLabel(AttributeList)}: the value is split on
 *       {@code :} into zero or more labels, {@code "Employee:Executive"}
 *       giving {@code [Employee, Executive]}</li>
 *   <li>{@link #resolveEdgeType(AttributeList, SourcePosition)}: the trimmed
 *       value is the relationship type, written as given; a missing label
 *       falls back to the default type</li>
 * </ul>
 *
 * <p>Values are coerced by trying boolean, then integer, then float, and
 * keeping the string otherwise. Coercion never fails.</p>
 */
public final class AttributeResolver {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        AttributeResolver.class);

    /** The reserved attribute name. */
    public static final String LABEL_ATTRIBUTE = "label";

    /** Relationship type used for edges without a label. */
    public static final String DEFAULT_RELATIONSHIP_TYPE = "RELATES_TO";

    /** Separator between node labels. */
    private static final Pattern LABEL_SEPARATOR = Pattern.compile(":");

    /** Optional sign followed by digits. */
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    /** Decimal number with optional fraction and exponent. */
    private static final Pattern FLOAT = Pattern.compile(
        "[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Relationship type for unlabelled edges. */
    private final String defaultRelationshipType;

    /**
     * Create a resolver with the {@value #DEFAULT_RELATIONSHIP_TYPE} default
     * type.
     */
    public AttributeResolver() {
        this(DEFAULT_RELATIONSHIP_TYPE);
    }

    /**
     * Create a resolver.
     *
     * @param defaultRelationshipType relationship type for unlabelled edges
     */
    public AttributeResolver(final String defaultRelationshipType) {
        if (defaultRelationshipType == null
                || defaultRelationshipType.isBlank()) {
            throw new IllegalArgumentException(
                "Default relationship type cannot be blank");
        }
        this.defaultRelationshipType = defaultRelationshipType.trim();
    }

    /**
     * Resolve every node and edge of a canonical graph.
     *
     * @param graph the canonical graph
     * @return the typed graph
     * @throws ResolutionException if an edge label is blank
     */
    public ResolvedGraph resolve(final CanonicalGraph graph)
            throws ResolutionException {
        List<ResolvedNode> nodes = new ArrayList<>(graph.nodes().size());
        for (NodeRecord node : graph.nodes()) {
            nodes.add(new ResolvedNode(node.getIdentifier(),
                resolveNodeLabel(node.getAttributes()),
                resolveProperties(node.getAttributes())));
        }

        List<ResolvedEdge> edges = new ArrayList<>(graph.edges().size());
        for (EdgeRecord edge : graph.edges()) {
            edges.add(new ResolvedEdge(edge.source(), edge.target(),
                edge.directed(),
                resolveEdgeType(edge.attributes(), edge.position()),
                resolveProperties(edge.attributes())));
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Resolved {} nodes and {} edges",
                nodes.size(), edges.size());
        }
        return new ResolvedGraph(graph.name(), graph.directed(), nodes, edges);
    }

    /**
     * Split a node's {@code label} attribute into labels.
     *
     * <p>Segments are trimmed and empty segments are dropped, so an absent
     * or empty label yields no labels.</p>
     *
     * @param attributes the node attributes
     * @return the labels in written order
     */
    public List<String> resolveNodeLabel(final AttributeList attributes) {
        String raw = attributes.get(LABEL_ATTRIBUTE);
        if (raw == null) {
            return List.of();
        }
        List<String> labels = new ArrayList<>();
        for (String segment : LABEL_SEPARATOR.split(raw, -1)) {
            String label = segment.trim();
            if (!label.isEmpty()) {
                labels.add(label);
            }
        }
        return labels;
    }

    /**
     * Derive an edge's relationship type from its {@code label} attribute.
     *
     * @param attributes the edge attributes
     * @param position where the edge is declared, for error reporting
     * @return the trimmed label, or the default type when there is none
     * @throws ResolutionException if the label is present but blank
     */
    public String resolveEdgeType(final AttributeList attributes,
            final SourcePosition position) throws ResolutionException {
        String raw = attributes.get(LABEL_ATTRIBUTE);
        if (raw == null) {
            return defaultRelationshipType;
        }
        String type = raw.trim();
        if (type.isEmpty()) {
            throw new ResolutionException(raw, position,
                "invalid relationship type");
        }
        return type;
    }

    /**
     * Type every attribute except {@code label}.
     *
     * @param attributes the attributes
     * @return the typed properties in attribute order
     */
    public List<TypedProperty> resolveProperties(
            final AttributeList attributes) {
        List<TypedProperty> properties = new ArrayList<>(attributes.size());
        for (Map.Entry<String, String> entry : attributes.asMap().entrySet()) {
            if (!LABEL_ATTRIBUTE.equals(entry.getKey())) {
                properties.add(coerce(entry.getKey(), entry.getValue()));
            }
        }
        return properties;
    }

    /**
     * Coerce a raw value: boolean, then integer, then float, else string.
     *
     * <p>Integers outside the {@code long} range are treated as floats;
     * values that would overflow a {@code double} stay strings.</p>
     *
     * @param name the property name
     * @param raw the raw value
     * @return the typed property
     */
    public static TypedProperty coerce(final String name, final String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return TypedProperty.ofBoolean(name, true);
        }
        if ("false".equalsIgnoreCase(raw)) {
            return TypedProperty.ofBoolean(name, false);
        }
        if (INTEGER.matcher(raw).matches()) {
            try {
                return TypedProperty.ofInteger(name, Long.parseLong(raw));
            } catch (NumberFormatException e) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Value of '{}' exceeds long range: {}",
                        name, raw);
                }
            }
        }
        if (FLOAT.matcher(raw).matches()) {
            double value = Double.parseDouble(raw);
            if (Double.isFinite(value)) {
                return TypedProperty.ofFloat(name, value);
            }
        }
        return TypedProperty.ofString(name, raw);
    }
}
