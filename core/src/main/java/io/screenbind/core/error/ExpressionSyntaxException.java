package io.screenbind.core.error;

/** Thrown when an expression contains an invalid character or violates the grammar. */
public final class ExpressionSyntaxException extends ExpressionParseException {

    private static final long serialVersionUID = 1L;

    public ExpressionSyntaxException(String message, String expression, int position) {
        super(message, expression, position);
    }
}
