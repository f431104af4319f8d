package io.screenbind.core.error;

/**
 * Thrown when an expression exceeds a parse-time ceiling: token count, nesting depth or
 * argument count.
 */
public final class ExpressionComplexityException extends ExpressionParseException {

    private static final long serialVersionUID = 1L;

    public ExpressionComplexityException(String message, String expression, int position) {
        super(message, expression, position);
    }
}
