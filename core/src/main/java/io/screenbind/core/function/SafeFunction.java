package io.screenbind.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A pure, total function reachable from binding expressions.
 *
 * <p>
 * Implementations MUST NOT throw for any argument shape: invalid input coerces to a safe default.
 * They MUST NOT execute anything supplied by their arguments, and MUST be stateless and
 * thread-safe.
 */
@FunctionalInterface
public interface SafeFunction {

    /**
     * Applies the function.
     *
     * @param args evaluated arguments, left to right; may be shorter than the declared parameter
     *             list
     * @return the result; {@code null} is treated as undefined by the evaluator
     */
    JsonNode apply(List<JsonNode> args);
}
