package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;

import java.util.List;

/**
 * An edge chain such as {@code a -> b -> {c d}} with its attributes.
 *
 * <p>Each pair of consecutive operands is connected; the operator of the
 * chain always matches the directedness of the enclosing document.</p>
 *
 * @param operands at least two operands, in source order
 * @param attributes the merged attribute lists, shared by every edge of
 *        the chain
 * @param position where the first operand starts
 */
public record EdgeStatement(List<EdgeOperand> operands,
        AttributeList attributes, SourcePosition position)
        implements DotStatement {

    /**
     * Validates and copies the operands.
     *
     * @param operands the operands
     * @param attributes the attributes
     * @param position the position
     */
    public EdgeStatement {
        if (operands.size() < 2) {
            throw new IllegalArgumentException(
                "An edge statement needs at least two operands");
        }
        operands = List.copyOf(operands);
    }
}
