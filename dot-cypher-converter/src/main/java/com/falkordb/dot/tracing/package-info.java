/**
 * OpenTelemetry tracing for the DOT to Cypher converter.
 *
 * <p>Spans are produced at two levels:</p>
 * <ol>
 *   <li>One span per conversion, with input size and output counts</li>
 *   <li>One child span per pipeline stage (lex, parse, build, resolve,
 *       emit)</li>
 * </ol>
 *
 * <p>Rendering adds a span per call, and the command-line tool wraps a
 * whole run in one.</p>
 *
 * <p>Traces are exported via OTLP protocol to a collector such as Jaeger.</p>
 *
 * @see com.falkordb.dot.tracing.TracingUtil
 */
package com.falkordb.dot.tracing;
