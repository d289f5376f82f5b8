package com.falkordb.dot.lexer;

/**
 * Classification of DOT lexemes.
 */
public enum TokenType {
    /** Bare word such as {@code A} or {@code node_1}. */
    IDENTIFIER,
    /** Numeral such as {@code 42}, {@code -1.5} or {@code .5}. */
    NUMERAL,
    /** Double-quoted string with the quotes removed and escapes applied. */
    QUOTED_STRING,
    /** One of {@code strict}, {@code graph}, {@code digraph},
     * {@code subgraph}, {@code node}, {@code edge}. */
    KEYWORD,
    /** {@code ->}. */
    DIRECTED_EDGE,
    /** {@code --}. */
    UNDIRECTED_EDGE,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    EQUALS,
    SEMICOLON,
    COLON,
    /** End of input. Always the last token. */
    EOF;

    /**
     * Whether tokens of this type can stand for a DOT ID.
     *
     * @return true for identifiers, numerals and quoted strings
     */
    public boolean isId() {
        return this == IDENTIFIER || this == NUMERAL || this == QUOTED_STRING;
    }
}
