package io.screenbind.core.error;

/**
 * Thrown when a function from a caller-supplied table fails. The built-in safe functions are total
 * and never cause this.
 */
public final class FunctionInvocationException extends ExpressionEvalException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    public FunctionInvocationException(String functionName, String expression, Throwable cause) {
        super("Function '" + functionName + "' failed: " + cause.getMessage(), cause, expression);
        this.functionName = functionName;
    }

    public String functionName() {
        return functionName;
    }
}
