package com.falkordb.dot.model;

import com.falkordb.dot.lexer.DotLexer;
import com.falkordb.dot.parser.DotParser;
import com.falkordb.dot.parser.GraphDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphBuilder and NodeRegistry.
 */
public class GraphBuilderTest {

    private static CanonicalGraph build(final String text) throws Exception {
        GraphDocument document =
            new DotParser(new DotLexer(text).tokenize()).parse();
        return new GraphBuilder().build(document);
    }

    private static List<String> nodeIds(final CanonicalGraph graph) {
        return graph.nodes().stream().map(NodeRecord::getIdentifier).toList();
    }

    private static List<String> edgePairs(final CanonicalGraph graph) {
        return graph.edges().stream()
            .map(e -> e.source() + ">" + e.target())
            .toList();
    }

    @Test
    @DisplayName("Test each identifier yields exactly one record")
    public void testIdentityUniqueness() throws Exception {
        CanonicalGraph graph = build(
            "digraph { a -> b; a [x=1]; b; a [x=2, y=3]; b -> a }");

        assertEquals(List.of("a", "b"), nodeIds(graph));
        NodeRecord a = graph.node(0);
        assertEquals(0, a.getHandle());
        assertEquals(Map.of("x", "2", "y", "3"), a.getAttributes().asMap());
        assertTrue(graph.node(1).getAttributes().isEmpty());
    }

    @Test
    @DisplayName("Test nodes keep first-appearance order")
    public void testFirstAppearanceOrder() throws Exception {
        CanonicalGraph graph = build("digraph { c -> a; b; a -> d }");
        assertEquals(List.of("c", "a", "b", "d"), nodeIds(graph));
        for (int i = 0; i < graph.nodes().size(); i++) {
            assertEquals(i, graph.node(i).getHandle());
        }
    }

    @Test
    @DisplayName("Test edge endpoints resolve to their records")
    public void testEdgeHandles() throws Exception {
        CanonicalGraph graph = build("digraph { x; a -> b }");
        EdgeRecord edge = graph.edges().get(0);
        assertEquals("a", graph.node(edge.sourceHandle()).getIdentifier());
        assertEquals("b", graph.node(edge.targetHandle()).getIdentifier());
        assertTrue(edge.directed());
    }

    @Test
    @DisplayName("Test parallel edges are all kept")
    public void testParallelEdges() throws Exception {
        CanonicalGraph graph = build(
            "strict digraph { a -> b; a -> b [w=2]; a -> a }");
        assertTrue(graph.strict());
        assertEquals(List.of("a>b", "a>b", "a>a"), edgePairs(graph));
        assertEquals("2", graph.edges().get(1).attributes().get("w"));
    }

    @Test
    @DisplayName("Test edge chain yields one edge per consecutive pair")
    public void testEdgeChain() throws Exception {
        CanonicalGraph graph = build("graph { a -- b -- c [w=1] }");
        assertEquals(List.of("a>b", "b>c"), edgePairs(graph));
        for (EdgeRecord edge : graph.edges()) {
            assertFalse(edge.directed());
            assertEquals("1", edge.attributes().get("w"));
        }
    }

    @Test
    @DisplayName("Test subgraph operands fan out to their nodes")
    public void testSubgraphOperands() throws Exception {
        CanonicalGraph graph = build("digraph { {a b} -> {c d} }");
        assertEquals(List.of("a", "b", "c", "d"), nodeIds(graph));
        assertEquals(List.of("a>c", "a>d", "b>c", "b>d"), edgePairs(graph));
    }

    @Test
    @DisplayName("Test subgraph bodies are flattened into the graph")
    public void testSubgraphFlattening() throws Exception {
        CanonicalGraph graph = build("digraph { subgraph cluster_0 "
            + "{ a [x=1] { b } } a -> c }");
        assertEquals(List.of("a", "b", "c"), nodeIds(graph));
        assertEquals("1", graph.node(0).getAttributes().get("x"));
        assertEquals(List.of("a>c"), edgePairs(graph));
    }

    @Test
    @DisplayName("Test graph attributes are collected")
    public void testGraphAttributes() throws Exception {
        CanonicalGraph graph = build("digraph Org { rankdir=LR; "
            + "graph [label=\"Org chart\"] node [shape=box] edge [color=red] }");
        assertEquals("Org", graph.name());
        assertEquals(Map.of("rankdir", "LR", "label", "Org chart"),
            graph.graphAttributes().asMap());
        assertTrue(graph.nodes().isEmpty());
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    @DisplayName("Test edge defaults apply to later edges")
    public void testEdgeDefaults() throws Exception {
        CanonicalGraph graph = build("digraph G { a -> b; "
            + "edge [label=\"KNOWS\"] c -> d; e -> f [label=\"LIKES\", w=1] }");

        assertTrue(graph.edges().get(0).attributes().isEmpty());
        assertEquals(Map.of("label", "KNOWS"),
            graph.edges().get(1).attributes().asMap());
        assertEquals(Map.of("label", "LIKES", "w", "1"),
            graph.edges().get(2).attributes().asMap());
    }

    @Test
    @DisplayName("Test node defaults apply to nodes created later")
    public void testNodeDefaults() throws Exception {
        CanonicalGraph graph = build("digraph { a; "
            + "node [label=\"Person\", age=1] b; c [age=2]; a [y=1] }");

        assertEquals(Map.of("y", "1"), graph.node(0).getAttributes().asMap());
        assertEquals(Map.of("label", "Person", "age", "1"),
            graph.node(1).getAttributes().asMap());
        assertEquals(Map.of("label", "Person", "age", "2"),
            graph.node(2).getAttributes().asMap());
    }

    @Test
    @DisplayName("Test defaults are scoped to their subgraph")
    public void testScopedDefaults() throws Exception {
        CanonicalGraph graph = build("digraph { node [label=\"Outer\"] "
            + "subgraph s { node [label=\"Inner\"] edge [w=1] a -> b } "
            + "c; d -> e; { node [label=\"T\"] x } -> y }");

        assertEquals(List.of("a", "b", "c", "d", "e", "x", "y"),
            nodeIds(graph));
        assertEquals("Inner", graph.node(0).getAttributes().get("label"));
        assertEquals("Inner", graph.node(1).getAttributes().get("label"));
        for (int i = 2; i <= 4; i++) {
            assertEquals("Outer", graph.node(i).getAttributes().get("label"));
        }
        assertEquals("T", graph.node(5).getAttributes().get("label"));
        assertEquals("Outer", graph.node(6).getAttributes().get("label"));

        assertEquals("1", graph.edges().get(0).attributes().get("w"));
        assertFalse(graph.edges().get(1).attributes().contains("w"));
    }

    @Test
    @DisplayName("Test builder is single-use")
    public void testSingleUse() throws Exception {
        GraphDocument document =
            new DotParser(new DotLexer("digraph { a }").tokenize()).parse();
        GraphBuilder builder = new GraphBuilder();
        builder.build(document);
        assertThrows(IllegalStateException.class,
            () -> builder.build(document));
    }

    @Test
    @DisplayName("Test registry lookups")
    public void testRegistry() {
        NodeRegistry registry = new NodeRegistry();
        NodeRecord first = registry.getOrCreate("a", null);
        assertSame(first, registry.getOrCreate("a", null));
        assertSame(first, registry.find("a"));
        assertNull(registry.find("b"));
        assertNull(registry.get(1));
        assertNull(registry.get(-1));
        assertEquals(1, registry.size());
        assertThrows(UnsupportedOperationException.class,
            () -> registry.records().clear());
    }
}
