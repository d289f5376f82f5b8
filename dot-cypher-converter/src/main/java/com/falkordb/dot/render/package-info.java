/**
 * Cypher text rendering of converted statements.
 */
package com.falkordb.dot.render;
