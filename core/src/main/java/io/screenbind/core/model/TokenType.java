package io.screenbind.core.model;

/**
 * Closed set of token kinds produced by the tokenizer. Operator and punctuation kinds carry the
 * source symbol they were lexed from.
 */
public enum TokenType {
    NUMBER("number"),
    STRING("string"),
    IDENTIFIER("identifier"),
    BOOLEAN("boolean"),
    NULL("null"),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    DOT("."),
    QUESTION("?"),
    COLON(":"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    EQ("=="),
    NE("!="),
    STRICT_EQ("==="),
    STRICT_NE("!=="),
    AND("&&"),
    OR("||"),
    NOT("!"),
    EOF("end of input");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** The operator text, or a descriptive name for value kinds. */
    public String symbol() {
        return symbol;
    }

    /** True for the eight equality and relational operators. */
    public boolean isComparison() {
        return switch (this) {
            case EQ, NE, STRICT_EQ, STRICT_NE, GT, GTE, LT, LTE -> true;
            default -> false;
        };
    }
}
