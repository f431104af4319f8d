package io.screenbind.core.engine;

/**
 * Resource ceilings for a single tokenize, parse, evaluate or function call. Each ceiling is
 * enforced by its own layer: the tokenizer counts tokens, the parser counts nesting and
 * arguments, the evaluator counts live depth, and collection functions truncate their input.
 *
 * <p>
 * Immutable and thread-safe.
 *
 * @param maxTokens        maximum tokens per expression, end-of-input excluded (default: 500)
 * @param maxParseDepth    maximum nested sub-expressions at parse time (default: 10)
 * @param maxArguments     maximum call arguments or array literal elements (default: 50)
 * @param maxEvalDepth     maximum live node depth during evaluation (default: 10)
 * @param maxArrayElements collection functions only look at this many elements (default: 10,000)
 */
public record EngineLimits(
        int maxTokens, int maxParseDepth, int maxArguments, int maxEvalDepth, int maxArrayElements) {

    public static final int DEFAULT_MAX_TOKENS = 500;
    public static final int DEFAULT_MAX_PARSE_DEPTH = 10;
    public static final int DEFAULT_MAX_ARGUMENTS = 50;
    public static final int DEFAULT_MAX_EVAL_DEPTH = 10;
    public static final int DEFAULT_MAX_ARRAY_ELEMENTS = 10_000;

    /** Default limits: 500 tokens, depth 10 at parse and eval time, 50 arguments, 10,000 elements. */
    public static final EngineLimits DEFAULT = new EngineLimits(
            DEFAULT_MAX_TOKENS,
            DEFAULT_MAX_PARSE_DEPTH,
            DEFAULT_MAX_ARGUMENTS,
            DEFAULT_MAX_EVAL_DEPTH,
            DEFAULT_MAX_ARRAY_ELEMENTS);

    public EngineLimits {
        requirePositive("maxTokens", maxTokens);
        requirePositive("maxParseDepth", maxParseDepth);
        requirePositive("maxArguments", maxArguments);
        requirePositive("maxEvalDepth", maxEvalDepth);
        requirePositive("maxArrayElements", maxArrayElements);
    }

    public EngineLimits withMaxTokens(int value) {
        return new EngineLimits(value, maxParseDepth, maxArguments, maxEvalDepth, maxArrayElements);
    }

    public EngineLimits withMaxParseDepth(int value) {
        return new EngineLimits(maxTokens, value, maxArguments, maxEvalDepth, maxArrayElements);
    }

    public EngineLimits withMaxArguments(int value) {
        return new EngineLimits(maxTokens, maxParseDepth, value, maxEvalDepth, maxArrayElements);
    }

    public EngineLimits withMaxEvalDepth(int value) {
        return new EngineLimits(maxTokens, maxParseDepth, maxArguments, value, maxArrayElements);
    }

    public EngineLimits withMaxArrayElements(int value) {
        return new EngineLimits(maxTokens, maxParseDepth, maxArguments, maxEvalDepth, value);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }
}
