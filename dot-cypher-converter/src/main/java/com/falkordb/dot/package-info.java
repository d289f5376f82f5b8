/**
 * DOT to Cypher conversion.
 *
 * <p>{@link com.falkordb.dot.DotToCypherConverter} is the entry point. It
 * runs the lexer, parser, graph builder, attribute resolver and statement
 * emitter in sequence and returns the statements in a
 * {@link com.falkordb.dot.ConversionResult}. Every stage failure is a
 * {@link com.falkordb.dot.DotConversionException}.</p>
 *
 * <p>Rendering the statements as Cypher text is handled separately by
 * {@link com.falkordb.dot.render.CypherRenderer}.</p>
 */
package com.falkordb.dot;
