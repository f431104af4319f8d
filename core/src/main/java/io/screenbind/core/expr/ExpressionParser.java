package io.screenbind.core.expr;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.engine.JsonValues;
import io.screenbind.core.error.ExpressionComplexityException;
import io.screenbind.core.error.ExpressionSyntaxException;
import io.screenbind.core.model.ExprNode;
import io.screenbind.core.model.Token;
import io.screenbind.core.model.TokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for binding expressions.
 *
 * <p>
 * Precedence, lowest to highest:
 * <ol>
 * <li>ternary {@code ?:} (right-associative)</li>
 * <li>{@code ||}</li>
 * <li>{@code &&}</li>
 * <li>comparison {@code == != === !== > >= < <=} (left fold)</li>
 * <li>additive {@code + -}</li>
 * <li>multiplicative {@code * / %}</li>
 * <li>unary {@code ! -}</li>
 * <li>call and member access</li>
 * <li>primary: literals, identifiers, {@code ( expr )}, array literals</li>
 * </ol>
 *
 * <p>
 * Every nested sub-expression (ternary branch, call argument, parenthesised group, array element,
 * index) counts one level of nesting; exceeding {@link EngineLimits#maxParseDepth()} or
 * {@link EngineLimits#maxArguments()} is a {@link ExpressionComplexityException}. Trailing tokens
 * after a complete expression are rejected.
 *
 * <p>
 * Thread-safe: parse state lives in a per-call cursor.
 */
public final class ExpressionParser {

    private final Tokenizer tokenizer;
    private final int maxDepth;
    private final int maxArguments;

    public ExpressionParser() {
        this(EngineLimits.DEFAULT);
    }

    public ExpressionParser(EngineLimits limits) {
        this.tokenizer = new Tokenizer(limits.maxTokens());
        this.maxDepth = limits.maxParseDepth();
        this.maxArguments = limits.maxArguments();
    }

    /**
     * Tokenizes and parses {@code source}.
     *
     * @throws ExpressionSyntaxException     on a lexical or grammar error
     * @throws ExpressionComplexityException when a token, nesting or argument ceiling is exceeded
     */
    public ExprNode parse(String source) {
        return new Cursor(tokenizer.tokenize(source), source).parseAll();
    }

    /** Parses an already tokenized expression. */
    public ExprNode parse(List<Token> tokens) {
        return new Cursor(tokens, null).parseAll();
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    /** Parse state for a single call. */
    private final class Cursor {

        private final List<Token> tokens;
        private final String source;
        private int pos;
        private int depth;

        Cursor(List<Token> tokens, String source) {
            this.tokens = tokens;
            this.source = source;
        }

        ExprNode parseAll() {
            ExprNode result = parseTernary();
            Token next = peek();
            if (next.type() != TokenType.EOF) {
                throw syntax("Unexpected token " + next.describe() + " after expression at position "
                        + next.position(), next);
            }
            return result;
        }

        private ExprNode parseNested() {
            depth++;
            if (depth > maxDepth) {
                throw new ExpressionComplexityException(
                        "Expression nesting too deep (>" + maxDepth + " levels)", source, peek().position());
            }
            try {
                return parseTernary();
            } finally {
                depth--;
            }
        }

        private ExprNode parseTernary() {
            ExprNode node = parseOr();
            if (peek().type() == TokenType.QUESTION) {
                advance();
                ExprNode consequent = parseNested();
                expect(TokenType.COLON);
                ExprNode alternate = parseNested();
                node = new ExprNode.Ternary(node, consequent, alternate);
            }
            return node;
        }

        private ExprNode parseOr() {
            ExprNode left = parseAnd();
            while (peek().type() == TokenType.OR) {
                advance();
                left = new ExprNode.Binary("||", left, parseAnd());
            }
            return left;
        }

        private ExprNode parseAnd() {
            ExprNode left = parseComparison();
            while (peek().type() == TokenType.AND) {
                advance();
                left = new ExprNode.Binary("&&", left, parseComparison());
            }
            return left;
        }

        private ExprNode parseComparison() {
            ExprNode left = parseAdditive();
            while (peek().type().isComparison()) {
                String op = advance().type().symbol();
                left = new ExprNode.Binary(op, left, parseAdditive());
            }
            return left;
        }

        private ExprNode parseAdditive() {
            ExprNode left = parseMultiplicative();
            while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
                String op = advance().type().symbol();
                left = new ExprNode.Binary(op, left, parseMultiplicative());
            }
            return left;
        }

        private ExprNode parseMultiplicative() {
            ExprNode left = parseUnary();
            while (peek().type() == TokenType.STAR
                    || peek().type() == TokenType.SLASH
                    || peek().type() == TokenType.PERCENT) {
                String op = advance().type().symbol();
                left = new ExprNode.Binary(op, left, parseUnary());
            }
            return left;
        }

        private ExprNode parseUnary() {
            if (peek().type() == TokenType.NOT) {
                advance();
                return new ExprNode.Unary("!", parseUnary());
            }
            if (peek().type() == TokenType.MINUS) {
                advance();
                return new ExprNode.Unary("-", parseUnary());
            }
            return parseCallOrAccess();
        }

        private ExprNode parseCallOrAccess() {
            ExprNode node = parsePrimary();
            while (true) {
                TokenType type = peek().type();
                if (type == TokenType.LPAREN) {
                    if (!(node instanceof ExprNode.Path) && !(node instanceof ExprNode.Literal)) {
                        break;
                    }
                    advance();
                    List<ExprNode> args = parseList(TokenType.RPAREN, "arguments");
                    node = new ExprNode.Call(callName(node), args);
                } else if (type == TokenType.DOT) {
                    advance();
                    Token prop = expect(TokenType.IDENTIFIER);
                    String name = (String) prop.value();
                    if (node instanceof ExprNode.Path path) {
                        List<String> segments = new ArrayList<>(path.segments());
                        segments.add(name);
                        node = new ExprNode.Path(segments);
                    } else {
                        node = new ExprNode.Path(List.of(primaryText(node), name));
                    }
                } else if (type == TokenType.LBRACKET) {
                    advance();
                    ExprNode index = parseNested();
                    expect(TokenType.RBRACKET);
                    if (node instanceof ExprNode.Path path && index instanceof ExprNode.Literal literal) {
                        List<String> segments = new ArrayList<>(path.segments());
                        segments.add(JsonValues.toText(literal.value()));
                        node = new ExprNode.Path(segments);
                    }
                } else {
                    break;
                }
            }
            return node;
        }

        private ExprNode parsePrimary() {
            Token t = peek();
            switch (t.type()) {
                case NUMBER:
                    advance();
                    return new ExprNode.Literal(JsonValues.number((Double) t.value()));
                case STRING:
                    advance();
                    return new ExprNode.Literal(JsonValues.text((String) t.value()));
                case BOOLEAN:
                    advance();
                    return new ExprNode.Literal(BooleanNode.valueOf((Boolean) t.value()));
                case NULL:
                    advance();
                    return new ExprNode.Literal(NullNode.getInstance());
                case IDENTIFIER:
                    advance();
                    return new ExprNode.Path(List.of((String) t.value()));
                case LPAREN: {
                    advance();
                    ExprNode inner = parseNested();
                    expect(TokenType.RPAREN);
                    return inner;
                }
                case LBRACKET:
                    advance();
                    return new ExprNode.ArrayLiteral(parseList(TokenType.RBRACKET, "array elements"));
                default:
                    throw syntax("Unexpected token " + t.describe() + " at position " + t.position(), t);
            }
        }

        /** Comma-separated expressions up to and including {@code close}. */
        private List<ExprNode> parseList(TokenType close, String what) {
            List<ExprNode> items = new ArrayList<>();
            if (peek().type() != close) {
                items.add(parseNested());
                while (peek().type() == TokenType.COMMA) {
                    advance();
                    if (items.size() >= maxArguments) {
                        throw new ExpressionComplexityException(
                                "Too many " + what + " (>" + maxArguments + ")", source, peek().position());
                    }
                    items.add(parseNested());
                }
            }
            expect(close);
            return items;
        }

        private String callName(ExprNode node) {
            if (node instanceof ExprNode.Path path) {
                return path.dotted();
            }
            return JsonValues.toText(((ExprNode.Literal) node).value());
        }

        /** Text of a non-path primary used as a path root: a truthy literal's text, else empty. */
        private String primaryText(ExprNode node) {
            if (node instanceof ExprNode.Literal literal && JsonValues.isTruthy(literal.value())) {
                return JsonValues.toText(literal.value());
            }
            return "";
        }

        private Token peek() {
            if (pos < tokens.size()) {
                return tokens.get(pos);
            }
            return new Token(TokenType.EOF, null, -1);
        }

        private Token advance() {
            Token t = peek();
            if (pos < tokens.size()) {
                pos++;
            }
            return t;
        }

        private Token expect(TokenType type) {
            Token t = advance();
            if (t.type() != type) {
                throw syntax("Expected '" + type.symbol() + "' but got " + t.describe() + " at position "
                        + t.position(), t);
            }
            return t;
        }

        private ExpressionSyntaxException syntax(String message, Token at) {
            return new ExpressionSyntaxException(message, source, at.position());
        }
    }
}
