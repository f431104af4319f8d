package io.screenbind.core.error;

/**
 * Abstract parent for tokenize/parse failures. These are authoring-time defects: they are
 * always raised to the caller of {@code Tokenizer} or {@code ExpressionParser} and only the
 * render path converts them into a default value. Always carries the source offset of the
 * failure.
 */
public abstract class ExpressionParseException extends BindingException {

    private static final long serialVersionUID = 1L;

    protected ExpressionParseException(String message, String expression, int position) {
        super(message, expression, position, Phase.PARSE);
    }
}
