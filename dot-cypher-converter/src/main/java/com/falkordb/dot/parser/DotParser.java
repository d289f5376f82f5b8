package com.falkordb.dot.parser;

import com.falkordb.dot.SourcePosition;
import com.falkordb.dot.lexer.Token;
import com.falkordb.dot.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Recursive-descent parser for the DOT subset understood by the converter.
 *
 * <h2>Grammar:</h2>
 * <pre>
 * graph     : [strict] (graph | digraph) [ID] '{' stmt_list '}'
 * stmt_list : (stmt [';'])*
 * stmt      : attr_stmt | ID '=' ID | edge_stmt | node_stmt | subgraph
 * attr_stmt : (graph | node | edge) attr_list+
 * node_stmt : ID (',' ID)* attr_list*
 * edge_stmt : operand (edgeop operand)+ attr_list*
 * operand   : ID | subgraph
 * subgraph  : [subgraph [ID]] '{' stmt_list '}'
 * attr_list : '[' [ID '=' ID ((',' | ';') ID '=' ID)*] [',' | ';'] ']'
 * </pre>
 *
 * <p>Newlines carry no meaning: {@code A [x=1] B [x=2]} is two node
 * statements. The edge operator must agree with the graph keyword,
 * {@code ->} in a {@code digraph} and {@code --} in a {@code graph}.
 * Node ports ({@code a:port}) are not supported.</p>
 */
public final class DotParser {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        DotParser.class);

    /** Default limit for nested subgraph blocks. */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    /** Tokens to parse, ending with EOF. */
    private final List<Token> tokens;

    /** Maximum subgraph nesting depth. */
    private final int maxNestingDepth;

    /** Index of the current token. */
    private int index;

    /** Set once the graph keyword is read. */
    private boolean directed;

    /** Current subgraph nesting depth. */
    private int depth;

    /**
     * Create a parser with the default nesting limit.
     *
     * @param tokens the tokens produced by the lexer
     */
    public DotParser(final List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Create a parser.
     *
     * @param tokens the tokens produced by the lexer, ending with EOF
     * @param maxNestingDepth the deepest allowed subgraph nesting
     */
    public DotParser(final List<Token> tokens, final int maxNestingDepth) {
        if (tokens == null || tokens.isEmpty()
                || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException(
                "Token list must end with an EOF token");
        }
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException(
                "Maximum nesting depth cannot be negative: " + maxNestingDepth);
        }
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parse the tokens into a document.
     *
     * @return the syntax tree
     * @throws ParseException if the tokens violate the grammar
     */
    public GraphDocument parse() throws ParseException {
        boolean strict = false;
        if (peek().isKeyword("strict")) {
            next();
            strict = true;
        }
        Token kind = next();
        if (kind.isKeyword("digraph")) {
            directed = true;
        } else if (kind.isKeyword("graph")) {
            directed = false;
        } else {
            throw unexpected(kind, "'graph' or 'digraph'");
        }

        String name = null;
        if (peek().type().isId()) {
            name = next().text();
        }
        expect(TokenType.LBRACE, "'{'");
        List<DotStatement> statements = statementList();
        expect(TokenType.RBRACE, "'}'");
        expect(TokenType.EOF, "end of input");

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parsed {} {} '{}' with {} top-level statements",
                strict ? "strict" : "non-strict",
                directed ? "digraph" : "graph", name, statements.size());
        }
        return new GraphDocument(strict, directed, name, statements);
    }

    private List<DotStatement> statementList() throws ParseException {
        List<DotStatement> statements = new ArrayList<>();
        while (peek().type() != TokenType.RBRACE
                && peek().type() != TokenType.EOF) {
            statement(statements);
            if (peek().type() == TokenType.SEMICOLON) {
                next();
            }
        }
        return statements;
    }

    private void statement(final List<DotStatement> out)
            throws ParseException {
        Token first = peek();

        if (first.isKeyword("graph") || first.isKeyword("node")
                || first.isKeyword("edge")) {
            next();
            if (peek().type() != TokenType.LBRACKET) {
                throw unexpected(peek(), "'[' after '" + first.text() + "'");
            }
            AttributeStatement.Target target = AttributeStatement.Target
                .valueOf(first.text().toUpperCase(Locale.ROOT));
            out.add(new AttributeStatement(target, attributeLists(),
                first.position()));
            return;
        }

        if (first.isKeyword("subgraph") || first.type() == TokenType.LBRACE) {
            SubgraphStatement subgraph = subgraph();
            if (isEdgeOperator(peek())) {
                out.add(edgeChain(subgraph));
            } else {
                out.add(subgraph);
            }
            return;
        }

        if (!first.type().isId()) {
            throw unexpected(first, "a statement");
        }
        next();

        if (peek().type() == TokenType.EQUALS) {
            next();
            Token value = expectId("attribute value");
            out.add(new AttributeStatement(AttributeStatement.Target.GRAPH,
                AttributeList.of(Map.of(first.text(), value.text())),
                first.position()));
            return;
        }
        rejectPort();

        if (isEdgeOperator(peek())) {
            out.add(edgeChain(
                new NodeReference(first.text(), first.position())));
            return;
        }

        List<Token> identifiers = new ArrayList<>();
        identifiers.add(first);
        while (peek().type() == TokenType.COMMA) {
            next();
            identifiers.add(expectId("node identifier"));
            rejectPort();
        }
        AttributeList attributes = attributeLists();
        for (Token id : identifiers) {
            out.add(new NodeStatement(id.text(), attributes, id.position()));
        }
    }

    private EdgeStatement edgeChain(final EdgeOperand head)
            throws ParseException {
        List<EdgeOperand> operands = new ArrayList<>();
        operands.add(head);
        while (isEdgeOperator(peek())) {
            Token operator = next();
            checkOperator(operator);
            operands.add(operand());
        }
        return new EdgeStatement(operands, attributeLists(), head.position());
    }

    private EdgeOperand operand() throws ParseException {
        Token token = peek();
        if (token.isKeyword("subgraph") || token.type() == TokenType.LBRACE) {
            return subgraph();
        }
        Token id = expectId("node identifier or subgraph");
        rejectPort();
        return new NodeReference(id.text(), id.position());
    }

    private SubgraphStatement subgraph() throws ParseException {
        SourcePosition start = peek().position();
        String name = null;
        if (peek().isKeyword("subgraph")) {
            next();
            if (peek().type().isId()) {
                name = next().text();
            }
        }
        Token open = expect(TokenType.LBRACE, "'{'");
        if (depth >= maxNestingDepth) {
            throw new ParseException(open.position(),
                "at most " + maxNestingDepth + " nested subgraphs",
                "Subgraph nesting exceeds the maximum depth of "
                    + maxNestingDepth);
        }
        depth++;
        List<DotStatement> body = statementList();
        depth--;
        expect(TokenType.RBRACE, "'}'");
        return new SubgraphStatement(name, body, start);
    }

    private AttributeList attributeLists() throws ParseException {
        AttributeList merged = AttributeList.EMPTY;
        while (peek().type() == TokenType.LBRACKET) {
            next();
            Map<String, String> values = new LinkedHashMap<>();
            while (peek().type() != TokenType.RBRACKET) {
                Token key = expectId("attribute name or ']'");
                expect(TokenType.EQUALS, "'=' after attribute '"
                    + key.text() + "'");
                Token value = expectId("attribute value");
                // duplicate keys keep their first slot, last value wins
                values.put(key.text(), value.text());
                TokenType separator = peek().type();
                if (separator == TokenType.COMMA
                        || separator == TokenType.SEMICOLON) {
                    next();
                } else if (separator != TokenType.RBRACKET) {
                    throw unexpected(peek(), "',' or ']'");
                }
            }
            next();
            merged = merged.merge(AttributeList.of(values));
        }
        return merged;
    }

    private void checkOperator(final Token operator) throws ParseException {
        boolean arrow = operator.type() == TokenType.DIRECTED_EDGE;
        if (arrow != directed) {
            throw new ParseException(operator.position(),
                directed ? "'->'" : "'--'",
                ParseException.OPERATOR_MISMATCH + ": '" + operator.text()
                    + "' used in a " + (directed ? "digraph" : "graph"));
        }
    }

    private void rejectPort() throws ParseException {
        if (peek().type() == TokenType.COLON) {
            throw new ParseException(peek().position(), "node identifier",
                "Node ports are not supported");
        }
    }

    private static boolean isEdgeOperator(final Token token) {
        return token.type() == TokenType.DIRECTED_EDGE
            || token.type() == TokenType.UNDIRECTED_EDGE;
    }

    private Token expectId(final String what) throws ParseException {
        Token token = peek();
        if (!token.type().isId()) {
            throw unexpected(token, what);
        }
        return next();
    }

    private Token expect(final TokenType type, final String what)
            throws ParseException {
        Token token = peek();
        if (token.type() != type) {
            throw unexpected(token, what);
        }
        return next();
    }

    private static ParseException unexpected(final Token found,
            final String expected) {
        return new ParseException(found.position(), expected,
            "Expected " + expected + " but found " + found.describe());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }
}
