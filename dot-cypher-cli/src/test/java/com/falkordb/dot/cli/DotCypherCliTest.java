package com.falkordb.dot.cli;

import com.falkordb.dot.render.RenderMode;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line tool.
 */
public class DotCypherCliTest {

    private static final String DOT = """
        digraph G {
          A [label="Person", name="John"]
          B [label="Company", name="Acme"]
          A -> B [label="WORKS_AT", role="Developer"]
        }
        """;

    private static final String STATEMENTS_SCRIPT =
        "CREATE (:Person {dotId: 'A', name: 'John'});\n"
            + "CREATE (:Company {dotId: 'B', name: 'Acme'});\n"
            + "MATCH (a {dotId: 'A'}), (b {dotId: 'B'})\n"
            + "CREATE (a)-[:WORKS_AT {role: 'Developer'}]->(b);";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(final String input, final Map<String, String> env,
            final String... args) {
        return DotCypherCli.run(args,
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8), env);
    }

    private int run(final byte[] input, final String... args) {
        return DotCypherCli.run(args, new ByteArrayInputStream(input),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8), Map.of());
    }

    /** DOT text with a Latin-1 byte where UTF-8 is expected, at offset 22. */
    private static byte[] latin1Dot() {
        byte[] head = "digraph { a [name=\"caf".getBytes(StandardCharsets.US_ASCII);
        byte[] tail = "\"] }".getBytes(StandardCharsets.US_ASCII);
        byte[] bytes = new byte[head.length + 1 + tail.length];
        System.arraycopy(head, 0, bytes, 0, head.length);
        bytes[head.length] = (byte) 0xE9;
        System.arraycopy(tail, 0, bytes, head.length + 1, tail.length);
        return bytes;
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Test converting standard input to standard output")
    public void testStdinToStdout() {
        int code = run(DOT, Map.of());

        assertEquals(DotCypherCli.EXIT_OK, code);
        assertEquals(STATEMENTS_SCRIPT + System.lineSeparator(), out());
        assertEquals("", err());
    }

    @Test
    @DisplayName("Test script mode from the command line")
    public void testScriptMode() {
        int code = run(DOT, Map.of(), "--mode", "script");

        assertEquals(DotCypherCli.EXIT_OK, code);
        assertEquals("CREATE (n0:Person {dotId: 'A', name: 'John'})\n"
                + "CREATE (n1:Company {dotId: 'B', name: 'Acme'})\n"
                + "CREATE (n0)-[:WORKS_AT {role: 'Developer'}]->(n1);"
                + System.lineSeparator(),
            out());
    }

    @Test
    @DisplayName("Test file input and output")
    public void testFiles(@TempDir final Path dir) throws Exception {
        Path input = dir.resolve("org.dot");
        Path output = dir.resolve("org.cypher");
        Files.writeString(input, DOT, StandardCharsets.UTF_8);

        int code = run("", Map.of(), "--input", input.toString(),
            "--output", output.toString());

        assertEquals(DotCypherCli.EXIT_OK, code);
        assertEquals("", out());
        assertEquals(STATEMENTS_SCRIPT + System.lineSeparator(),
            Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Test environment variables supply defaults")
    public void testEnvironment() {
        int code = run("digraph { a -> b }", Map.of(
            DotCypherCli.ENV_MODE, "script",
            DotCypherCli.ENV_ID_PROPERTY, "key",
            DotCypherCli.ENV_DEFAULT_TYPE, "LINKS"));

        assertEquals(DotCypherCli.EXIT_OK, code);
        assertEquals("CREATE (n0 {key: 'a'})\n"
                + "CREATE (n1 {key: 'b'})\n"
                + "CREATE (n0)-[:LINKS]->(n1);" + System.lineSeparator(),
            out());
    }

    @Test
    @DisplayName("Test options take precedence over the environment")
    public void testOptionPrecedence() {
        DotCypherCli.Settings settings = DotCypherCli.Settings.parse(
            new String[] {"--mode", "STATEMENTS", "--id-property", "uid",
                "--max-depth", "3"},
            Map.of(DotCypherCli.ENV_MODE, "script",
                DotCypherCli.ENV_ID_PROPERTY, "key",
                DotCypherCli.ENV_MAX_NESTING_DEPTH, "9",
                DotCypherCli.ENV_MAX_INPUT_SIZE, "100"));

        assertEquals(RenderMode.STATEMENTS, settings.getRenderer().getMode());
        assertEquals("uid", settings.getRenderer().getIdProperty());
        assertEquals(3, settings.getOptions().getMaxNestingDepth());
        assertEquals(100, settings.getOptions().getMaxInputSize());
        assertNull(settings.getInput());
        assertNull(settings.getOutput());
        assertFalse(settings.isHelp());
    }

    @Test
    @DisplayName("Test help output")
    public void testHelp() {
        int code = run("", Map.of(), "--help");

        assertEquals(DotCypherCli.EXIT_OK, code);
        assertTrue(out().contains("Usage:"));
        assertTrue(out().contains("--mode <mode>"));
    }

    @Test
    @DisplayName("Test invalid command lines exit with usage status")
    public void testUsageErrors() {
        assertEquals(DotCypherCli.EXIT_USAGE, run(DOT, Map.of(), "--bogus"));
        assertTrue(err().contains("Unknown option: --bogus"));

        assertEquals(DotCypherCli.EXIT_USAGE, run(DOT, Map.of(), "--mode"));
        assertTrue(err().contains("Missing value for --mode"));

        assertEquals(DotCypherCli.EXIT_USAGE,
            run(DOT, Map.of(), "--mode", "batch"));
        assertTrue(err().contains("Invalid mode: batch"));

        assertEquals(DotCypherCli.EXIT_USAGE,
            run(DOT, Map.of(), "--max-depth", "deep"));
        assertEquals(DotCypherCli.EXIT_USAGE,
            run(DOT, Map.of(), "--id-property", "not valid"));
        assertEquals("", out());
    }

    @Test
    @DisplayName("Test conversion errors exit with failure status")
    public void testConversionError() {
        int code = run("graph { a -> b }", Map.of());

        assertEquals(DotCypherCli.EXIT_FAILURE, code);
        assertTrue(err().startsWith("Conversion failed: 1:11: "));
        assertEquals("", out());
    }

    @Test
    @DisplayName("Test input size limit from the command line")
    public void testMaxInputSize() {
        int code = run(DOT, Map.of(), "--max-input-size", "5");

        assertEquals(DotCypherCli.EXIT_FAILURE, code);
        assertTrue(err().contains("exceeds the maximum of 5"));
    }

    @Test
    @DisplayName("Test missing input file exits with failure status")
    public void testMissingInputFile(@TempDir final Path dir) {
        int code = run("", Map.of(), "--input",
            dir.resolve("absent.dot").toString());

        assertEquals(DotCypherCli.EXIT_FAILURE, code);
        assertTrue(err().contains("I/O error"));
    }

    @Test
    @DisplayName("Test malformed UTF-8 on standard input is rejected")
    public void testMalformedStdin() {
        int code = run(latin1Dot());

        assertEquals(DotCypherCli.EXIT_FAILURE, code);
        assertEquals("", out());
        assertTrue(err().startsWith(
            "Invalid input: stdin is not valid UTF-8 at byte offset 22"));
    }

    @Test
    @DisplayName("Test malformed UTF-8 in an input file is rejected")
    public void testMalformedFile(@TempDir final Path dir) throws Exception {
        Path input = dir.resolve("latin1.dot");
        Files.write(input, latin1Dot());

        int code = run("", Map.of(), "--input", input.toString());

        assertEquals(DotCypherCli.EXIT_FAILURE, code);
        assertTrue(err().contains(
            "latin1.dot is not valid UTF-8 at byte offset 22"));
    }

    @Test
    @DisplayName("Test leading byte order mark is skipped")
    public void testByteOrderMark(@TempDir final Path dir) throws Exception {
        byte[] dot = DOT.getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[dot.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(dot, 0, bytes, 3, dot.length);
        Path input = dir.resolve("bom.dot");
        Files.write(input, bytes);

        assertEquals(DotCypherCli.EXIT_OK,
            run("", Map.of(), "--input", input.toString()));
        assertEquals(DotCypherCli.EXIT_OK, run(bytes));
        assertEquals(STATEMENTS_SCRIPT + System.lineSeparator()
                + STATEMENTS_SCRIPT + System.lineSeparator(),
            out());
    }

    @Test
    @DisplayName("Test decoding keeps non-ASCII text")
    public void testDecode() throws Exception {
        assertEquals("café", DotCypherCli.decode(
            "café".getBytes(StandardCharsets.UTF_8), "test"));
        assertEquals("", DotCypherCli.decode(new byte[0], "test"));
        assertThrows(DotCypherCli.InputEncodingException.class,
            () -> DotCypherCli.decode(new byte[] {'a', (byte) 0xF0, (byte) 0x9F},
                "test"));
    }

    @Test
    @DisplayName("Test empty graph writes no output")
    public void testEmptyGraph(@TempDir final Path dir) throws Exception {
        assertEquals(DotCypherCli.EXIT_OK, run("digraph {}", Map.of()));
        assertEquals("", out());

        Path output = dir.resolve("empty.cypher");
        assertEquals(DotCypherCli.EXIT_OK,
            run("graph G { }", Map.of(), "--output", output.toString()));
        assertEquals("", Files.readString(output, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Verify run span is recorded")
    public void testRunSpan() {
        InMemorySpanExporter exporter = InMemorySpanExporter.create();
        try (SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build()) {
            int code = DotCypherCli.run(new String[] {"--mode", "script"},
                new ByteArrayInputStream(DOT.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), Map.of(),
                provider.get("com.falkordb.dot.cli"));
            assertEquals(DotCypherCli.EXIT_OK, code);

            DotCypherCli.run(new String[0],
                new ByteArrayInputStream(latin1Dot()),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), Map.of(),
                provider.get("com.falkordb.dot.cli"));

            List<SpanData> spans = exporter.getFinishedSpanItems();
            assertEquals(2, spans.size());

            SpanData ok = spans.get(0);
            assertEquals("DotCypherCli.run", ok.getName());
            assertEquals(StatusCode.OK, ok.getStatus().getStatusCode());
            assertEquals("stdin", ok.getAttributes()
                .get(AttributeKey.stringKey("cli.input")));
            assertEquals("SCRIPT", ok.getAttributes()
                .get(AttributeKey.stringKey("cypher.render.mode")));
            assertEquals(3L, ok.getAttributes()
                .get(AttributeKey.longKey("cypher.statement_count")));
            assertEquals(0L, ok.getAttributes()
                .get(AttributeKey.longKey("cli.exit_code")));

            SpanData failed = spans.get(1);
            assertEquals(StatusCode.ERROR, failed.getStatus().getStatusCode());
            assertEquals(1L, failed.getAttributes()
                .get(AttributeKey.longKey("cli.exit_code")));
            assertEquals(1, failed.getEvents().size());
        }
    }
}
