package com.falkordb.dot.cli;

import com.falkordb.dot.ConversionOptions;
import com.falkordb.dot.ConversionResult;
import com.falkordb.dot.DotConversionException;
import com.falkordb.dot.DotToCypherConverter;
import com.falkordb.dot.render.CypherRenderer;
import com.falkordb.dot.render.RenderMode;
import com.falkordb.dot.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point that converts a DOT file into a Cypher script.
 *
 * <p>Reads DOT text from a file or standard input and writes the rendered
 * queries, separated by {@code ;}, to a file or standard output. Input must
 * be UTF-8; a leading byte order mark is skipped and malformed bytes fail
 * the run. An empty graph produces empty output.</p>
 *
 * <p>Example:</p>
 * <pre>
 * java -jar dot-cypher-cli.jar --input org.dot --mode script
 * </pre>
 *
 * <p>Options given on the command line take precedence over the
 * environment variables listed in the usage text.</p>
 */
public final class DotCypherCli {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        DotCypherCli.class);

    /** Exit code for success. */
    static final int EXIT_OK = 0;
    /** Exit code for conversion and I/O failures. */
    static final int EXIT_FAILURE = 1;
    /** Exit code for invalid command lines. */
    static final int EXIT_USAGE = 2;

    /** Environment variable for the render mode. */
    static final String ENV_MODE = "DOT_CYPHER_MODE";
    /** Environment variable for the id property. */
    static final String ENV_ID_PROPERTY = "DOT_CYPHER_ID_PROPERTY";
    /** Environment variable for the default relationship type. */
    static final String ENV_DEFAULT_TYPE = "DOT_CYPHER_DEFAULT_TYPE";
    /** Environment variable for the maximum input size. */
    static final String ENV_MAX_INPUT_SIZE = "DOT_MAX_INPUT_SIZE";
    /** Environment variable for the maximum nesting depth. */
    static final String ENV_MAX_NESTING_DEPTH = "DOT_MAX_NESTING_DEPTH";

    /** Name recorded for standard input. */
    private static final String STDIN = "stdin";

    /** Byte order mark, as decoded. */
    private static final char BOM = '\uFEFF';

    /** Attribute key for the input source. */
    private static final AttributeKey<String> ATTR_INPUT =
        AttributeKey.stringKey("cli.input");

    /** Attribute key for the render mode. */
    private static final AttributeKey<String> ATTR_MODE =
        AttributeKey.stringKey("cypher.render.mode");

    /** Attribute key for the number of statements written. */
    private static final AttributeKey<Long> ATTR_STATEMENT_COUNT =
        AttributeKey.longKey("cypher.statement_count");

    /** Attribute key for the exit code. */
    private static final AttributeKey<Long> ATTR_EXIT_CODE =
        AttributeKey.longKey("cli.exit_code");

    /** Prevent instantiation of this utility class. */
    private DotCypherCli() {
        throw new AssertionError("No instances");
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        int code = run(args, System.in, System.out, System.err,
            System.getenv());
        TracingUtil.shutdown();
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * Run the tool with explicit streams and environment.
     * This method is package-private to allow testing.
     *
     * @param args command line arguments
     * @param in standard input
     * @param out standard output
     * @param err standard error
     * @param env environment variables
     * @return the exit code
     */
    static int run(final String[] args, final InputStream in,
            final PrintStream out, final PrintStream err,
            final Map<String, String> env) {
        return run(args, in, out, err, env,
            TracingUtil.getTracer(TracingUtil.SCOPE_CLI));
    }

    /**
     * Run the tool, tracing the conversion with the given tracer.
     *
     * @param args command line arguments
     * @param in standard input
     * @param out standard output
     * @param err standard error
     * @param env environment variables
     * @param tracer tracer for the run span
     * @return the exit code
     */
    static int run(final String[] args, final InputStream in,
            final PrintStream out, final PrintStream err,
            final Map<String, String> env, final Tracer tracer) {
        Settings settings;
        try {
            settings = Settings.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Run with --help for usage.");
            return EXIT_USAGE;
        }
        if (settings.help) {
            printUsage(out);
            return EXIT_OK;
        }

        String source = settings.input == null
            ? STDIN : settings.input.toString();
        Span span = tracer.spanBuilder("DotCypherCli.run")
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_INPUT, source)
            .setAttribute(ATTR_MODE, settings.renderer.getMode().name())
            .startSpan();

        try (Scope scope = span.makeCurrent()) {
            byte[] bytes = settings.input == null
                ? in.readAllBytes()
                : Files.readAllBytes(settings.input);
            String dot = decode(bytes, source);

            DotToCypherConverter converter =
                new DotToCypherConverter(settings.options);
            ConversionResult result = converter.convert(dot);
            String script = settings.renderer.renderScript(result.statements());
            write(script, settings.output, out);

            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Converted {} '{}' into {} statements ({} nodes)",
                    result.directed() ? "digraph" : "graph",
                    result.graphName() == null ? "" : result.graphName(),
                    result.statements().size(), result.nodes().size());
            }
            span.setAttribute(ATTR_STATEMENT_COUNT,
                (long) result.statements().size());
            span.setAttribute(ATTR_EXIT_CODE, (long) EXIT_OK);
            span.setStatus(StatusCode.OK);
            return EXIT_OK;
        } catch (InputEncodingException e) {
            fail(span, e);
            err.println("Invalid input: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (DotConversionException e) {
            fail(span, e);
            err.println("Conversion failed: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            fail(span, e);
            LOGGER.error("I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            span.end();
        }
    }

    private static void fail(final Span span, final Exception e) {
        span.setAttribute(ATTR_EXIT_CODE, (long) EXIT_FAILURE);
        span.setStatus(StatusCode.ERROR, e.getMessage());
        span.recordException(e);
    }

    /**
     * Decode UTF-8 input strictly, dropping a leading byte order mark.
     *
     * @param bytes the raw input
     * @param source input name for error messages
     * @return the decoded text
     * @throws InputEncodingException if the bytes are not valid UTF-8
     */
    static String decode(final byte[] bytes, final String source)
            throws InputEncodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer input = ByteBuffer.wrap(bytes);
        // UTF-8 never yields more chars than bytes
        CharBuffer output = CharBuffer.allocate(bytes.length);
        CoderResult result = decoder.decode(input, output, true);
        if (!result.isError()) {
            result = decoder.flush(output);
        }
        if (result.isError()) {
            throw new InputEncodingException(source
                + " is not valid UTF-8 at byte offset " + input.position());
        }
        output.flip();
        if (output.hasRemaining() && output.get(0) == BOM) {
            output.position(1);
        }
        return output.toString();
    }

    /**
     * Write the script followed by a line separator; an empty script
     * writes nothing.
     */
    private static void write(final String script, final Path output,
            final PrintStream out) throws IOException {
        String text = script.isEmpty() ? "" : script + System.lineSeparator();
        if (output == null) {
            out.print(text);
            out.flush();
        } else {
            Files.writeString(output, text, StandardCharsets.UTF_8);
        }
    }

    /**
     * Print usage information.
     *
     * @param out where to print
     */
    private static void printUsage(final PrintStream out) {
        out.println("""
            DOT to Cypher Converter

            Usage:
              java -jar dot-cypher-cli.jar [options]

            Options:
              --input <file>          DOT file to read (default: stdin)
              --output <file>         Cypher file to write (default: stdout)
              --mode <mode>           statements | script (default: statements)
              --id-property <name>    Property storing DOT node ids (default: dotId)
              --default-type <TYPE>   Type of unlabelled edges (default: RELATES_TO)
              --max-input-size <n>    Maximum input size in characters
              --max-depth <n>         Maximum subgraph nesting depth
              --help                  Show this help message

            Environment Variables (used when the option is absent):
              DOT_CYPHER_MODE, DOT_CYPHER_ID_PROPERTY, DOT_CYPHER_DEFAULT_TYPE,
              DOT_MAX_INPUT_SIZE, DOT_MAX_NESTING_DEPTH
              OTEL_TRACING_ENABLED    Export traces over OTLP (default: false)""");
    }

    /**
     * Input bytes that are not valid UTF-8.
     */
    static final class InputEncodingException extends IOException {
        private static final long serialVersionUID = 1L;

        InputEncodingException(final String message) {
            super(message);
        }
    }

    /**
     * Settings resolved from arguments and environment.
     */
    static final class Settings {
        /** Input file, or null for stdin. */
        private Path input;
        /** Output file, or null for stdout. */
        private Path output;
        /** Whether only usage was requested. */
        private boolean help;
        /** Conversion options. */
        private ConversionOptions options;
        /** Configured renderer. */
        private CypherRenderer renderer;

        private Settings() {
        }

        static Settings parse(final String[] args,
                final Map<String, String> env) {
            Settings settings = new Settings();
            String mode = env.get(ENV_MODE);
            String idProperty = env.get(ENV_ID_PROPERTY);
            String defaultType = env.get(ENV_DEFAULT_TYPE);
            String maxInputSize = env.get(ENV_MAX_INPUT_SIZE);
            String maxDepth = env.get(ENV_MAX_NESTING_DEPTH);

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--help", "-h" -> settings.help = true;
                    case "--input" -> settings.input = Path.of(value(args, ++i, arg));
                    case "--output" -> settings.output = Path.of(value(args, ++i, arg));
                    case "--mode" -> mode = value(args, ++i, arg);
                    case "--id-property" -> idProperty = value(args, ++i, arg);
                    case "--default-type" -> defaultType = value(args, ++i, arg);
                    case "--max-input-size" -> maxInputSize = value(args, ++i, arg);
                    case "--max-depth" -> maxDepth = value(args, ++i, arg);
                    default -> throw new IllegalArgumentException(
                        "Unknown option: " + arg);
                }
            }

            ConversionOptions.Builder options = ConversionOptions.builder();
            if (isSet(defaultType)) {
                options.defaultRelationshipType(defaultType);
            }
            if (isSet(maxInputSize)) {
                options.maxInputSize(parseInt(maxInputSize, "maximum input size"));
            }
            if (isSet(maxDepth)) {
                options.maxNestingDepth(parseInt(maxDepth, "maximum depth"));
            }
            settings.options = options.build();

            CypherRenderer.Builder renderer = CypherRenderer.builder();
            if (isSet(mode)) {
                renderer.mode(parseMode(mode));
            }
            if (isSet(idProperty)) {
                renderer.idProperty(idProperty);
            }
            settings.renderer = renderer.build();
            return settings;
        }

        private static String value(final String[] args, final int index,
                final String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(
                    "Missing value for " + option);
            }
            return args[index];
        }

        private static boolean isSet(final String value) {
            return value != null && !value.isEmpty();
        }

        private static int parseInt(final String value, final String what) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid " + what + ": " + value, e);
            }
        }

        private static RenderMode parseMode(final String value) {
            try {
                return RenderMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                    "Invalid mode: " + value + " (expected statements or script)",
                    e);
            }
        }

        Path getInput() {
            return input;
        }

        Path getOutput() {
            return output;
        }

        boolean isHelp() {
            return help;
        }

        ConversionOptions getOptions() {
            return options;
        }

        CypherRenderer getRenderer() {
            return renderer;
        }
    }
}
