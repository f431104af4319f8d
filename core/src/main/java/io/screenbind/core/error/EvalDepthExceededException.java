package io.screenbind.core.error;

/**
 * Thrown when the live evaluation depth exceeds the configured maximum. Checked independently of
 * the parser's nesting ceiling.
 */
public final class EvalDepthExceededException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    public EvalDepthExceededException(int maxDepth, String expression) {
        super("Evaluation depth exceeded maximum of " + maxDepth, expression);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
