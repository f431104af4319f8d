package io.screenbind.core.error;

/** Thrown when a call node names a function that is not in the active function table. */
public final class UnknownFunctionException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    public UnknownFunctionException(String functionName, String expression) {
        super("Unknown function: '" + functionName + "'", expression);
        this.functionName = functionName;
    }

    /** The name that failed the lookup. */
    public String functionName() {
        return functionName;
    }
}
