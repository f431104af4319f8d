package io.screenbind.core.expr;

import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.function.FunctionTable;
import io.screenbind.core.function.SafeFunctions;
import java.util.Objects;

/**
 * Per-call evaluation settings.
 *
 * @param maxDepth  live evaluation depth ceiling, must be positive
 * @param functions the only functions a {@code Call} node may reach
 */
public record EvalOptions(int maxDepth, FunctionTable functions) {

    public static final EvalOptions DEFAULT = new EvalOptions(EngineLimits.DEFAULT_MAX_EVAL_DEPTH, SafeFunctions.table());

    public EvalOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        Objects.requireNonNull(functions, "functions must not be null");
    }

    public EvalOptions withMaxDepth(int value) {
        return new EvalOptions(value, functions);
    }

    public EvalOptions withFunctions(FunctionTable value) {
        return new EvalOptions(maxDepth, value);
    }
}
