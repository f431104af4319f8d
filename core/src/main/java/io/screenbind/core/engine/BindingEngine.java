package io.screenbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.screenbind.core.error.BindingException;
import io.screenbind.core.error.EvalDepthExceededException;
import io.screenbind.core.error.ExpressionComplexityException;
import io.screenbind.core.error.ExpressionSyntaxException;
import io.screenbind.core.error.UnknownFunctionException;
import io.screenbind.core.expr.EvalOptions;
import io.screenbind.core.expr.ExpressionEvaluator;
import io.screenbind.core.expr.ExpressionParser;
import io.screenbind.core.expr.ExpressionValidator;
import io.screenbind.core.function.FunctionTable;
import io.screenbind.core.function.SafeFunctions;
import io.screenbind.core.model.BindingContext;
import io.screenbind.core.model.ExprNode;
import io.screenbind.core.model.ValidationIssue;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point that wires the parser, evaluator, function table and renderer around one set of
 * {@link EngineLimits}.
 *
 * <p>
 * Two method families share the same core:
 * <ul>
 * <li><b>Hard path</b> ({@link #parse}, {@link #evaluate}, {@link #evaluateExpression}): errors
 * propagate as {@link BindingException} subclasses. Used by validation tooling.</li>
 * <li><b>Soft path</b> ({@link #render}, {@link #renderOrDefault}): never throws for a malformed
 * binding; the failure degrades to a default value and is logged at DEBUG. Used by the UI
 * runtime on every render pass.</li>
 * </ul>
 *
 * <p>
 * While a soft-path call runs, the context's trace id is exposed to the logging backend as the
 * MDC key {@code traceId}.
 *
 * <p>
 * State writes ({@link #applyBindings}, {@link #applyActionResult}) go through
 * {@link BindingMutators} with this engine's array cap.
 *
 * <p>
 * Soft-path results never share containers with the context, so callers may edit them freely.
 * Hard-path results are not copied: a path that resolves to an object or array returns the live
 * node from the context.
 *
 * <p>
 * Thread-safe: immutable after construction. The {@code state} documents passed in are not
 * guarded.
 */
public final class BindingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(BindingEngine.class);

    /** MDC key carrying {@link BindingContext#traceId()}. */
    public static final String MDC_TRACE_ID = "traceId";

    private final EngineLimits limits;
    private final FunctionTable functions;
    private final ExpressionParser parser;
    private final EvalOptions evalOptions;
    private final TemplateRenderer renderer;

    public BindingEngine() {
        this(EngineLimits.DEFAULT);
    }

    /** Uses the built-in safe functions, capped at {@code limits.maxArrayElements()}. */
    public BindingEngine(EngineLimits limits) {
        this(limits, SafeFunctions.table(limits.maxArrayElements()));
    }

    /**
     * @param limits    resource ceilings for parsing and evaluation
     * @param functions the only functions expressions may call
     */
    public BindingEngine(EngineLimits limits, FunctionTable functions) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
        this.parser = new ExpressionParser(limits);
        this.evalOptions = new EvalOptions(limits.maxEvalDepth(), functions);
        this.renderer = new TemplateRenderer(parser, evalOptions);
        LOG.debug("BindingEngine created: limits={}, functions={}", limits, functions.size());
    }

    // --- Hard path ---

    /**
     * Tokenizes and parses an expression.
     *
     * @throws ExpressionSyntaxException     on malformed input
     * @throws ExpressionComplexityException when a parse-time ceiling is exceeded
     */
    public ExprNode parse(String expression) {
        return parser.parse(expression);
    }

    /**
     * Evaluates a parsed tree.
     *
     * @throws UnknownFunctionException   if a call names a function outside the table
     * @throws EvalDepthExceededException if the live depth exceeds {@code maxEvalDepth}
     */
    public JsonNode evaluate(ExprNode ast, BindingContext context) {
        return ExpressionEvaluator.evaluate(ast, context, evalOptions);
    }

    /** Parses and evaluates in one step; any {@link BindingException} propagates. */
    public JsonNode evaluateExpression(String expression, BindingContext context) {
        ExprNode ast = parser.parse(expression);
        return ExpressionEvaluator.evaluate(ast, context, evalOptions, expression);
    }

    // --- Soft path ---

    /** Renders a template. Never throws for malformed bindings. */
    public JsonNode render(JsonNode template, BindingContext context) {
        return withTraceContext(context, () -> renderer.render(template, context));
    }

    /** Renders a plain Java template (maps, lists, strings). */
    public JsonNode render(Object template, BindingContext context) {
        return withTraceContext(context, () -> renderer.render(template, context));
    }

    /**
     * Evaluates {@code expression}, returning {@code fallback} when it fails to parse or evaluate
     * or when the result is undefined.
     */
    public JsonNode renderOrDefault(String expression, BindingContext context, JsonNode fallback) {
        JsonNode defaultValue = fallback != null ? fallback : NullNode.getInstance();
        return withTraceContext(context, () -> {
            try {
                JsonNode result = evaluateExpression(expression, context);
                if (JsonValues.isUndefined(result)) {
                    return defaultValue;
                }
                return result.isContainerNode() ? result.deepCopy() : result;
            } catch (BindingException e) {
                LOG.debug("Expression '{}' fell back to default: {}", expression, e.getMessage());
                return defaultValue;
            }
        });
    }

    // --- State ---

    /** {@link BindingMutators#applyBindings} with this engine's limits. */
    public void applyBindings(ObjectNode state, Map<String, String> bindings, BindingContext context) {
        BindingMutators.applyBindings(state, bindings, context, limits);
    }

    /** {@link BindingMutators#applyActionResultToState} with this engine's limits. */
    public void applyActionResult(ObjectNode state, String actionId, JsonNode result) {
        BindingMutators.applyActionResultToState(state, actionId, result, limits);
    }

    // --- Validation ---

    /** A validator whose allow-list is this engine's function table. */
    public ExpressionValidator validator() {
        return new ExpressionValidator(functions.names(), parser);
    }

    public List<ValidationIssue> validate(String expression) {
        return validator().validate(expression);
    }

    public EngineLimits limits() {
        return limits;
    }

    public FunctionTable functions() {
        return functions;
    }

    public TemplateRenderer renderer() {
        return renderer;
    }

    private static <T> T withTraceContext(BindingContext context, Supplier<T> work) {
        String traceId = context != null ? context.traceId() : null;
        if (traceId == null) {
            return work.get();
        }
        MDC.put(MDC_TRACE_ID, traceId);
        try {
            return work.get();
        } finally {
            MDC.remove(MDC_TRACE_ID);
        }
    }
}
