package com.falkordb.dot.lexer;

import com.falkordb.dot.SourcePosition;

import java.util.Locale;

/**
 * A classified lexeme with the position where it starts.
 *
 * @param type the token type
 * @param text the token text; for quoted strings the unescaped content,
 *        for keywords the lower-case keyword
 * @param position where the token starts
 */
public record Token(TokenType type, String text, SourcePosition position) {

    /**
     * Check whether this token is the given keyword.
     *
     * @param keyword the lower-case keyword
     * @return true if this is a keyword token with that text
     */
    public boolean isKeyword(final String keyword) {
        return type == TokenType.KEYWORD
            && text.equals(keyword.toLowerCase(Locale.ROOT));
    }

    /**
     * Describe the token for error messages.
     *
     * @return a short human readable description
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case QUOTED_STRING -> "string \"" + text + "\"";
            default -> "'" + text + "'";
        };
    }
}
