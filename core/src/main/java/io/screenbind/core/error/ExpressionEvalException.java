package io.screenbind.core.error;

/**
 * Abstract parent for evaluation errors raised by {@code ExpressionEvaluator}. Callers on the
 * render path never observe these; the renderer maps them to its default value.
 */
public abstract class ExpressionEvalException extends BindingException {

    private static final long serialVersionUID = 1L;

    protected ExpressionEvalException(String message, String expression) {
        super(message, expression, UNKNOWN_POSITION, Phase.EVALUATION);
    }

    protected ExpressionEvalException(String message, Throwable cause, String expression) {
        super(message, cause, expression, Phase.EVALUATION);
    }
}
