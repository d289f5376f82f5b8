package com.falkordb.dot.resolve;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.parser.AttributeList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AttributeResolver.
 */
public class AttributeResolverTest {

    private final AttributeResolver resolver = new AttributeResolver();

    private static AttributeList attributes(final String... pairs) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            values.put(pairs[i], pairs[i + 1]);
        }
        return AttributeList.of(values);
    }

    @Test
    @DisplayName("Test node label splitting")
    public void testNodeLabels() {
        assertEquals(List.of("Person"),
            resolver.resolveNodeLabel(attributes("label", "Person")));
        assertEquals(List.of("Employee", "Executive"),
            resolver.resolveNodeLabel(attributes("label", "Employee:Executive")));
        assertEquals(List.of("A", "B"),
            resolver.resolveNodeLabel(attributes("label", " A :: B: ")));
        assertEquals(List.of(),
            resolver.resolveNodeLabel(attributes("label", "")));
        assertEquals(List.of(),
            resolver.resolveNodeLabel(attributes("name", "x")));
    }

    @Test
    @DisplayName("Test edge type comes from the label as written")
    public void testEdgeType() throws Exception {
        assertEquals("WORKS_AT", resolver.resolveEdgeType(
            attributes("label", "WORKS_AT"), null));
        assertEquals("knows", resolver.resolveEdgeType(
            attributes("label", " knows "), null));
        assertEquals("RELATES_TO", resolver.resolveEdgeType(
            attributes("weight", "1"), null));
    }

    @Test
    @DisplayName("Test configured default relationship type")
    public void testCustomDefaultType() throws Exception {
        AttributeResolver custom = new AttributeResolver("LINKS");
        assertEquals("LINKS",
            custom.resolveEdgeType(AttributeList.EMPTY, null));
        assertThrows(IllegalArgumentException.class,
            () -> new AttributeResolver(" "));
    }

    @Test
    @DisplayName("Test blank edge label is rejected")
    public void testBlankEdgeLabel() {
        SourcePosition position = new SourcePosition(3, 7);
        ResolutionException e = assertThrows(ResolutionException.class,
            () -> resolver.resolveEdgeType(attributes("label", "  "), position));
        assertEquals(position, e.getPosition());
        assertEquals("  ", e.getValue());
        assertTrue(e.getMessage().contains("invalid relationship type"));
    }

    @Test
    @DisplayName("Test label is excluded from properties and order is kept")
    public void testPropertiesExcludeLabel() {
        List<TypedProperty> properties = resolver.resolveProperties(
            attributes("name", "John", "label", "Person", "age", "30"));
        assertEquals(List.of(
                TypedProperty.ofString("name", "John"),
                TypedProperty.ofInteger("age", 30)),
            properties);
    }

    @Test
    @DisplayName("Test boolean coercion is case-insensitive")
    public void testBooleanCoercion() {
        assertEquals(TypedProperty.ofBoolean("b", true),
            AttributeResolver.coerce("b", "true"));
        assertEquals(TypedProperty.ofBoolean("b", true),
            AttributeResolver.coerce("b", "TRUE"));
        assertEquals(TypedProperty.ofBoolean("b", false),
            AttributeResolver.coerce("b", "False"));
        assertEquals(PropertyKind.STRING,
            AttributeResolver.coerce("b", "yes").kind());
    }

    @Test
    @DisplayName("Test integer coercion")
    public void testIntegerCoercion() {
        assertEquals(TypedProperty.ofInteger("n", 30),
            AttributeResolver.coerce("n", "30"));
        assertEquals(TypedProperty.ofInteger("n", -5),
            AttributeResolver.coerce("n", "-5"));
        assertEquals(TypedProperty.ofInteger("n", 7),
            AttributeResolver.coerce("n", "+7"));
        assertEquals(TypedProperty.ofInteger("n", 7),
            AttributeResolver.coerce("n", "007"));
    }

    @Test
    @DisplayName("Test integer outside long range becomes float")
    public void testIntegerOverflow() {
        TypedProperty property =
            AttributeResolver.coerce("n", "99999999999999999999");
        assertEquals(PropertyKind.FLOAT, property.kind());
        assertEquals(1e20, (Double) property.value(), 1e5);
    }

    @Test
    @DisplayName("Test float coercion")
    public void testFloatCoercion() {
        assertEquals(TypedProperty.ofFloat("f", 3.14),
            AttributeResolver.coerce("f", "3.14"));
        assertEquals(TypedProperty.ofFloat("f", 0.5),
            AttributeResolver.coerce("f", ".5"));
        assertEquals(TypedProperty.ofFloat("f", 7.0),
            AttributeResolver.coerce("f", "7."));
        assertEquals(TypedProperty.ofFloat("f", 1500.0),
            AttributeResolver.coerce("f", "1.5e3"));
        assertEquals(PropertyKind.STRING,
            AttributeResolver.coerce("f", "1e999").kind());
    }

    @Test
    @DisplayName("Test everything else stays a string")
    public void testStringFallback() {
        for (String raw : List.of("", " 30", "30 ", "1.2.3", "NaN",
                "Infinity", "0x1F", "12abc", "-", ".")) {
            TypedProperty property = AttributeResolver.coerce("s", raw);
            assertEquals(PropertyKind.STRING, property.kind(), raw);
            assertEquals(raw, property.value());
        }
    }

    @Test
    @DisplayName("Test typed property rejects a mismatched value")
    public void testTypedPropertyValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new TypedProperty("x", PropertyKind.INTEGER, "1"));
        assertThrows(IllegalArgumentException.class,
            () -> new TypedProperty("x", PropertyKind.FLOAT, Double.NaN));
        assertThrows(NullPointerException.class,
            () -> new TypedProperty("x", PropertyKind.STRING, null));
    }
}
