package com.falkordb.dot.lexer;

import com.falkordb.dot.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits DOT text into tokens.
 *
 * <p>Whitespace, {@code //} and {@code /* *}{@code /} comments and
 * {@code #} preprocessor lines are discarded. Quoted strings may span lines;
 * {@code \"} and {@code \\} are unescaped, a backslash before a newline
 * joins the two lines, and every other backslash sequence is kept verbatim.
 * Quoted strings joined with {@code +} are concatenated into one token.</p>
 *
 * <p>A lexer instance is single-use: create one per input text.</p>
 */
public final class DotLexer {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        DotLexer.class);

    /** Words that are keywords when written bare, in any case. */
    private static final Set<String> KEYWORDS = Set.of(
        "strict", "graph", "digraph", "subgraph", "node", "edge");

    /** The text being scanned. */
    private final String input;

    /** Index of the next character to read. */
    private int offset;

    /** Current line, 1-based. */
    private int line = 1;

    /** Current column, 1-based. */
    private int column = 1;

    /** Tokens produced so far. */
    private final List<Token> tokens = new ArrayList<>();

    /**
     * Create a lexer for the given text.
     *
     * @param input the DOT text
     */
    public DotLexer(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input cannot be null");
        }
        this.input = input;
    }

    /**
     * Tokenize the whole input.
     *
     * @return the tokens, terminated by a single {@link TokenType#EOF}
     * @throws LexException if the input contains an illegal character, an
     *         unterminated string or an unterminated comment
     */
    public List<Token> tokenize() throws LexException {
        if (!tokens.isEmpty()) {
            throw new IllegalStateException("Lexer has already been used");
        }
        while (true) {
            skipTrivia();
            if (atEnd()) {
                tokens.add(new Token(TokenType.EOF, "", position()));
                break;
            }
            tokens.add(nextToken());
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Tokenized {} characters into {} tokens",
                input.length(), tokens.size());
        }
        return List.copyOf(tokens);
    }

    private Token nextToken() throws LexException {
        SourcePosition start = position();
        char c = peek();
        switch (c) {
            case '[':
                advance();
                return new Token(TokenType.LBRACKET, "[", start);
            case ']':
                advance();
                return new Token(TokenType.RBRACKET, "]", start);
            case '{':
                advance();
                return new Token(TokenType.LBRACE, "{", start);
            case '}':
                advance();
                return new Token(TokenType.RBRACE, "}", start);
            case ',':
                advance();
                return new Token(TokenType.COMMA, ",", start);
            case '=':
                advance();
                return new Token(TokenType.EQUALS, "=", start);
            case ';':
                advance();
                return new Token(TokenType.SEMICOLON, ";", start);
            case ':':
                advance();
                return new Token(TokenType.COLON, ":", start);
            case '"':
                return new Token(TokenType.QUOTED_STRING, quoted(), start);
            case '+':
                return concatenation(start);
            case '-':
                if (peekAt(1) == '>') {
                    advance();
                    advance();
                    return new Token(TokenType.DIRECTED_EDGE, "->", start);
                }
                if (peekAt(1) == '-') {
                    advance();
                    advance();
                    return new Token(TokenType.UNDIRECTED_EDGE, "--", start);
                }
                return numeral(start);
            default:
                if (c == '.' || isDigit(c)) {
                    return numeral(start);
                }
                if (isIdentifierStart(c)) {
                    return word(start);
                }
                throw new LexException(start, c,
                    "Unexpected character '" + c + "'");
        }
    }

    private Token word(final SourcePosition start) {
        int begin = offset;
        while (!atEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(begin, offset);
        String lower = text.toLowerCase(Locale.ROOT);
        if (KEYWORDS.contains(lower)) {
            return new Token(TokenType.KEYWORD, lower, start);
        }
        return new Token(TokenType.IDENTIFIER, text, start);
    }

    private Token numeral(final SourcePosition start) throws LexException {
        int begin = offset;
        if (peek() == '-') {
            advance();
        }
        int digits = 0;
        while (!atEnd() && isDigit(peek())) {
            advance();
            digits++;
        }
        if (!atEnd() && peek() == '.') {
            advance();
            while (!atEnd() && isDigit(peek())) {
                advance();
                digits++;
            }
        }
        if (digits == 0) {
            int bad = atEnd() ? -1 : peek();
            throw new LexException(start, input.charAt(begin),
                "Malformed numeral '" + input.substring(begin, offset) + "'"
                    + (bad < 0 ? "" : " before '" + (char) bad + "'"));
        }
        if (!atEnd() && isIdentifierStart(peek())) {
            throw new LexException(position(), peek(),
                "Numeral '" + input.substring(begin, offset)
                    + "' is directly followed by '" + peek() + "'");
        }
        return new Token(TokenType.NUMERAL, input.substring(begin, offset),
            start);
    }

    private String quoted() throws LexException {
        SourcePosition start = position();
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw new LexException(start, -1, "Unterminated quoted string");
            }
            char c = advance();
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\' && !atEnd()) {
                char next = peek();
                if (next == '"' || next == '\\') {
                    sb.append(advance());
                    continue;
                }
                if (next == '\n') {
                    advance();
                    continue;
                }
                if (next == '\r' && peekAt(1) == '\n') {
                    advance();
                    advance();
                    continue;
                }
            }
            sb.append(c);
        }
    }

    private Token concatenation(final SourcePosition start)
            throws LexException {
        Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        if (previous == null || previous.type() != TokenType.QUOTED_STRING) {
            throw new LexException(start, '+',
                "'+' may only join two quoted strings");
        }
        advance();
        skipTrivia();
        if (atEnd() || peek() != '"') {
            throw new LexException(position(), atEnd() ? -1 : peek(),
                "Expected a quoted string after '+'");
        }
        String tail = quoted();
        tokens.remove(tokens.size() - 1);
        return new Token(TokenType.QUOTED_STRING, previous.text() + tail,
            previous.position());
    }

    private void skipTrivia() throws LexException {
        while (!atEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                skipLine();
            } else if (c == '#' && atLineStart()) {
                skipLine();
            } else if (c == '/' && peekAt(1) == '*') {
                SourcePosition start = position();
                advance();
                advance();
                while (!(peek() == '*' && peekAt(1) == '/')) {
                    if (atEnd()) {
                        throw new LexException(start, -1,
                            "Unterminated block comment");
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private void skipLine() {
        while (!atEnd() && peek() != '\n') {
            advance();
        }
    }

    private boolean atLineStart() {
        for (int i = offset - 1; i >= 0; i--) {
            char c = input.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private boolean atEnd() {
        return offset >= input.length();
    }

    private char peek() {
        return atEnd() ? '\0' : input.charAt(offset);
    }

    private char peekAt(final int ahead) {
        int index = offset + ahead;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourcePosition position() {
        return new SourcePosition(line, column);
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
            || c >= '\u0080';
    }

    private static boolean isIdentifierPart(final char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
