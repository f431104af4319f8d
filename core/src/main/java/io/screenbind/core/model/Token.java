package io.screenbind.core.model;

import java.util.Objects;

/**
 * A single lexed token.
 *
 * @param type     the token kind
 * @param value    the decoded value: {@link Double} for numbers, {@link String} for strings,
 *                 identifiers and operators, {@link Boolean} for booleans, {@code null} for the
 *                 null keyword and end of input
 * @param position zero-based offset of the first character of the token
 */
public record Token(TokenType type, Object value, int position) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
    }

    /** Text used in error messages. */
    public String describe() {
        return switch (type) {
            case NUMBER, STRING, IDENTIFIER -> type.symbol() + " '" + value + "'";
            default -> "'" + type.symbol() + "'";
        };
    }
}
