package com.falkordb.dot.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Shared OpenTelemetry setup for conversion, rendering and the command-line
 * tool.
 *
 * <p>Tracing is off unless {@code OTEL_TRACING_ENABLED=true}; the tracers
 * handed out are then no-ops. When enabled, spans are batched and exported
 * over OTLP/gRPC to {@code OTEL_EXPORTER_OTLP_ENDPOINT}
 * (default {@value #DEFAULT_OTLP_ENDPOINT}) under
 * {@code OTEL_SERVICE_NAME} (default {@value #DEFAULT_SERVICE_NAME}).</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Environment variable that turns tracing on. */
    static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";
    /** Environment variable for the OTLP endpoint. */
    static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
    /** Environment variable for the service name. */
    static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Service name when none is configured. */
    static final String DEFAULT_SERVICE_NAME = "dot-cypher-converter";
    /** OTLP endpoint when none is configured. */
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Resource attribute carrying the service name. */
    static final AttributeKey<String> SERVICE_NAME =
        AttributeKey.stringKey("service.name");

    /** Instrumentation scope of the conversion pipeline. */
    public static final String SCOPE_CONVERTER =
        "com.falkordb.dot.DotToCypherConverter";

    /** Instrumentation scope of Cypher rendering. */
    public static final String SCOPE_RENDERER =
        "com.falkordb.dot.render.CypherRenderer";

    /** Instrumentation scope of the command-line tool. */
    public static final String SCOPE_CLI = "com.falkordb.dot.cli";

    /** Process-wide instance, created on first use. */
    private static volatile OpenTelemetry openTelemetry;

    /** Guards creation of {@link #openTelemetry}. */
    private static final Object INIT_LOCK = new Object();

    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * Get the process-wide instance, configured from the environment on
     * first call.
     *
     * @return the OpenTelemetry instance
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    OpenTelemetry created = create(System.getenv());
                    if (created instanceof OpenTelemetrySdk sdk) {
                        Runtime.getRuntime().addShutdownHook(
                            new Thread(sdk.getSdkTracerProvider()::shutdown));
                    }
                    openTelemetry = created;
                }
            }
        }
        return openTelemetry;
    }

    /**
     * Get a tracer for an instrumentation scope.
     *
     * @param scopeName one of the {@code SCOPE_*} names
     * @return the tracer
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * Flush and stop span export. Does nothing when tracing is off.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            LOGGER.debug("Shutting down OpenTelemetry SDK");
            sdk.getSdkTracerProvider().shutdown();
        }
    }

    /**
     * Build an OpenTelemetry instance from environment variables.
     *
     * @param env environment variables
     * @return {@link OpenTelemetry#noop()} when tracing is off, otherwise an
     *         SDK exporting over OTLP; the caller owns its shutdown
     */
    static OpenTelemetry create(final Map<String, String> env) {
        if (!Boolean.parseBoolean(env.get(ENV_TRACING_ENABLED))) {
            LOGGER.debug("OpenTelemetry tracing is disabled");
            return OpenTelemetry.noop();
        }

        String serviceName = valueOrDefault(env, ENV_SERVICE_NAME,
            DEFAULT_SERVICE_NAME);
        String endpoint = valueOrDefault(env, ENV_OTLP_ENDPOINT,
            DEFAULT_OTLP_ENDPOINT);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Exporting traces for {} to {}", serviceName, endpoint);
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build())
                .build())
            .setResource(Resource.getDefault().merge(Resource.create(
                Attributes.of(SERVICE_NAME, serviceName))))
            .build();
        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .build();
    }

    private static String valueOrDefault(final Map<String, String> env,
            final String name, final String defaultValue) {
        String value = env.get(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
