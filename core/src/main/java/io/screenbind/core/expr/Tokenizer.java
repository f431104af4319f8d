package io.screenbind.core.expr;

import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.error.ExpressionComplexityException;
import io.screenbind.core.error.ExpressionSyntaxException;
import io.screenbind.core.model.Token;
import io.screenbind.core.model.TokenType;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for binding expressions.
 *
 * <p>
 * Numbers are unsigned decimals (a sign is a unary operator, not part of the literal). Strings
 * take single or double quotes; a backslash makes the next character literal. Identifiers may
 * contain letters, digits, {@code _} and {@code $}; {@code true}, {@code false} and {@code null}
 * are keywords. Three-character operators are matched before two-character ones, which are
 * matched before single characters.
 *
 * <p>
 * Thread-safe: immutable after construction.
 */
public final class Tokenizer {

    private final int maxTokens;

    public Tokenizer() {
        this(EngineLimits.DEFAULT_MAX_TOKENS);
    }

    /**
     * @param maxTokens tokens allowed per expression, end-of-input excluded
     */
    public Tokenizer(int maxTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got: " + maxTokens);
        }
        this.maxTokens = maxTokens;
    }

    /**
     * Tokenizes {@code source}. The returned list always ends with an {@link TokenType#EOF}
     * token.
     *
     * @throws ExpressionSyntaxException     on a character that starts no token, or a malformed
     *                                       number
     * @throws ExpressionComplexityException when the token count exceeds the ceiling
     */
    public List<Token> tokenize(String source) {
        String input = source != null ? source : "";
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int len = input.length();

        while (i < len) {
            char ch = input.charAt(i);

            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }

            int start = i;
            if (isDigit(ch) || (ch == '.' && i + 1 < len && isDigit(input.charAt(i + 1)))) {
                while (i < len && (isDigit(input.charAt(i)) || input.charAt(i) == '.')) {
                    i++;
                }
                add(tokens, new Token(TokenType.NUMBER, parseNumber(input, start, i), start), input);
                continue;
            }

            if (ch == '\'' || ch == '"') {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < len && input.charAt(i) != ch) {
                    if (input.charAt(i) == '\\' && i + 1 < len) {
                        i++;
                    }
                    sb.append(input.charAt(i));
                    i++;
                }
                if (i < len) {
                    i++; // closing quote
                }
                add(tokens, new Token(TokenType.STRING, sb.toString(), start), input);
                continue;
            }

            if (isIdentifierStart(ch)) {
                while (i < len && isIdentifierPart(input.charAt(i))) {
                    i++;
                }
                add(tokens, keywordOrIdentifier(input.substring(start, i), start), input);
                continue;
            }

            TokenType op = operator(input, i);
            if (op != null) {
                add(tokens, new Token(op, op.symbol(), start), input);
                i += op.symbol().length();
                continue;
            }

            throw new ExpressionSyntaxException(
                    "Unexpected character '" + ch + "' at position " + i, source, i);
        }

        tokens.add(new Token(TokenType.EOF, null, len));
        return tokens;
    }

    public int maxTokens() {
        return maxTokens;
    }

    private void add(List<Token> tokens, Token token, String source) {
        if (tokens.size() >= maxTokens) {
            throw new ExpressionComplexityException(
                    "Expression too complex (>" + maxTokens + " tokens)", source, token.position());
        }
        tokens.add(token);
    }

    private static Double parseNumber(String input, int start, int end) {
        String text = input.substring(start, end);
        if (text.indexOf('.') != text.lastIndexOf('.')) {
            throw new ExpressionSyntaxException("Malformed number '" + text + "' at position " + start, input, start);
        }
        return Double.valueOf(text);
    }

    private static Token keywordOrIdentifier(String word, int start) {
        return switch (word) {
            case "true" -> new Token(TokenType.BOOLEAN, Boolean.TRUE, start);
            case "false" -> new Token(TokenType.BOOLEAN, Boolean.FALSE, start);
            case "null" -> new Token(TokenType.NULL, null, start);
            default -> new Token(TokenType.IDENTIFIER, word, start);
        };
    }

    /** Longest operator or punctuation token starting at {@code i}, or {@code null}. */
    private static TokenType operator(String input, int i) {
        if (input.startsWith("===", i)) {
            return TokenType.STRICT_EQ;
        }
        if (input.startsWith("!==", i)) {
            return TokenType.STRICT_NE;
        }
        if (i + 1 < input.length()) {
            switch (input.substring(i, i + 2)) {
                case "==":
                    return TokenType.EQ;
                case "!=":
                    return TokenType.NE;
                case ">=":
                    return TokenType.GTE;
                case "<=":
                    return TokenType.LTE;
                case "&&":
                    return TokenType.AND;
                case "||":
                    return TokenType.OR;
                default:
                    break;
            }
        }
        return switch (input.charAt(i)) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case '.' -> TokenType.DOT;
            case '?' -> TokenType.QUESTION;
            case ':' -> TokenType.COLON;
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '>' -> TokenType.GT;
            case '<' -> TokenType.LT;
            case '!' -> TokenType.NOT;
            default -> null;
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
