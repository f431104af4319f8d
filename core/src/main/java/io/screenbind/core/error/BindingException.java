package io.screenbind.core.error;

/**
 * Abstract base for all screen-binding exceptions. Never thrown directly; use the concrete
 * subclasses under {@link ExpressionParseException} or {@link ExpressionEvalException}.
 *
 * <p>
 * Every failure is tied to the binding expression that caused it. Parse failures also know the
 * offset of the offending token, which {@link #excerpt()} turns into a caret marker for editors
 * and validation reports.
 */
public abstract class BindingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Offset value used when the failure is not tied to one token. */
    public static final int UNKNOWN_POSITION = -1;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EVALUATION
    }

    private final String expression;
    private final int position;
    private final Phase phase;

    protected BindingException(String message, String expression, int position, Phase phase) {
        super(message);
        this.expression = expression;
        this.position = position;
        this.phase = phase;
    }

    protected BindingException(String message, Throwable cause, String expression, Phase phase) {
        super(message, cause);
        this.expression = expression;
        this.position = UNKNOWN_POSITION;
        this.phase = phase;
    }

    /** The expression source that triggered the error, or {@code null} if not known. */
    public String expression() {
        return expression;
    }

    /** Zero-based offset into the expression source, or {@link #UNKNOWN_POSITION}. */
    public int position() {
        return position;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /**
     * The expression with a caret line under the failing offset, e.g.
     *
     * <pre>
     * a + #
     *     ^
     * </pre>
     *
     * Without a known offset this is the bare expression; without an expression it is empty.
     */
    public String excerpt() {
        if (expression == null) {
            return "";
        }
        if (position < 0 || position > expression.length()) {
            return expression;
        }
        return expression + "\n" + " ".repeat(position) + "^";
    }
}
