package io.screenbind.core.expr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.screenbind.core.engine.JsonValues;
import io.screenbind.core.engine.PathResolver;
import io.screenbind.core.error.BindingException;
import io.screenbind.core.error.EvalDepthExceededException;
import io.screenbind.core.error.FunctionInvocationException;
import io.screenbind.core.error.UnknownFunctionException;
import io.screenbind.core.function.SafeFunction;
import io.screenbind.core.model.BindingContext;
import io.screenbind.core.model.ExprNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks an {@link ExprNode} tree against a {@link BindingContext}.
 *
 * <p>
 * Only functions present in {@link EvalOptions#functions()} can be invoked; there is no fallback
 * lookup. Every node visit counts one level of live depth, so a shallow tree of nested calls is
 * still bounded by {@link EvalOptions#maxDepth()} independently of the parser's nesting check.
 *
 * <p>
 * Operator semantics:
 * <ul>
 * <li>{@code +} concatenates when either side is text or a container, otherwise adds</li>
 * <li>{@code - * / %} are numeric; a zero divisor yields {@code 0}; a NaN result yields
 * {@code 0}</li>
 * <li>{@code == !=} loose, {@code === !==} strict, see {@link JsonValues}</li>
 * <li>{@code > >= < <=} compare both sides as numbers</li>
 * <li>{@code && ||} evaluate both sides and return one of the operand values</li>
 * </ul>
 *
 * <p>
 * A path result is the context's own node, not a copy; callers that hand results on must copy
 * containers themselves.
 *
 * <p>
 * Thread-safe: stateless, the depth counter lives in a per-call walker.
 */
public final class ExpressionEvaluator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ExpressionEvaluator() {}

    public static JsonNode evaluate(ExprNode node, BindingContext context) {
        return evaluate(node, context, EvalOptions.DEFAULT, null);
    }

    public static JsonNode evaluate(ExprNode node, BindingContext context, EvalOptions options) {
        return evaluate(node, context, options, null);
    }

    /**
     * Evaluates {@code node}.
     *
     * @param source the expression text the tree was parsed from, used only in error messages; may
     *               be {@code null}
     * @return the result; {@link MissingNode} stands for undefined
     * @throws UnknownFunctionException    if a call names a function outside the table
     * @throws EvalDepthExceededException  if the live depth exceeds {@code options.maxDepth()}
     * @throws FunctionInvocationException if a caller-supplied function throws
     */
    public static JsonNode evaluate(ExprNode node, BindingContext context, EvalOptions options, String source) {
        BindingContext ctx = context != null ? context : BindingContext.empty();
        EvalOptions opts = options != null ? options : EvalOptions.DEFAULT;
        return new Walker(ctx, opts, source).visit(node);
    }

    private static final class Walker {

        private final BindingContext context;
        private final EvalOptions options;
        private final String source;
        private int depth;

        Walker(BindingContext context, EvalOptions options, String source) {
            this.context = context;
            this.options = options;
            this.source = source;
        }

        JsonNode visit(ExprNode node) {
            depth++;
            if (depth > options.maxDepth()) {
                throw new EvalDepthExceededException(options.maxDepth(), source);
            }
            try {
                return dispatch(node);
            } finally {
                depth--;
            }
        }

        private JsonNode dispatch(ExprNode node) {
            if (node instanceof ExprNode.Literal literal) {
                return literal.value();
            }
            if (node instanceof ExprNode.Path path) {
                return resolve(path);
            }
            if (node instanceof ExprNode.Call call) {
                return call(call);
            }
            if (node instanceof ExprNode.Binary binary) {
                return binary(binary);
            }
            if (node instanceof ExprNode.Unary unary) {
                return unary(unary);
            }
            if (node instanceof ExprNode.Ternary ternary) {
                return JsonValues.isTruthy(visit(ternary.condition()))
                        ? visit(ternary.consequent())
                        : visit(ternary.alternate());
            }
            if (node instanceof ExprNode.ArrayLiteral array) {
                ArrayNode out = NODES.arrayNode();
                for (ExprNode element : array.elements()) {
                    out.add(orNull(visit(element)));
                }
                return out;
            }
            throw new IllegalStateException("Unhandled node type: " + node.getClass().getName());
        }

        private JsonNode resolve(ExprNode.Path path) {
            List<String> segments = path.segments();
            JsonNode root = context.root(segments.get(0));
            return PathResolver.getSegments(root, segments.subList(1, segments.size()));
        }

        private JsonNode call(ExprNode.Call call) {
            SafeFunction function = options.functions()
                    .lookup(call.name())
                    .orElseThrow(() -> new UnknownFunctionException(call.name(), source));
            List<JsonNode> args = new ArrayList<>(call.args().size());
            for (ExprNode arg : call.args()) {
                args.add(visit(arg));
            }
            JsonNode result;
            try {
                result = function.apply(args);
            } catch (BindingException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new FunctionInvocationException(call.name(), source, e);
            }
            return result != null ? result : MissingNode.getInstance();
        }

        private JsonNode binary(ExprNode.Binary binary) {
            JsonNode left = visit(binary.left());
            JsonNode right = visit(binary.right());
            switch (binary.op()) {
                case "+":
                    if (isTextLike(left) || isTextLike(right)) {
                        return JsonValues.text(JsonValues.toText(left) + JsonValues.toText(right));
                    }
                    return arithmetic(num(left) + num(right));
                case "-":
                    return arithmetic(num(left) - num(right));
                case "*":
                    return arithmetic(num(left) * num(right));
                case "/": {
                    double divisor = num(right);
                    return divisor == 0 ? JsonValues.number(0) : arithmetic(num(left) / divisor);
                }
                case "%": {
                    double divisor = num(right);
                    return divisor == 0 ? JsonValues.number(0) : arithmetic(num(left) % divisor);
                }
                case "==":
                    return BooleanNode.valueOf(JsonValues.looseEquals(left, right));
                case "!=":
                    return BooleanNode.valueOf(!JsonValues.looseEquals(left, right));
                case "===":
                    return BooleanNode.valueOf(JsonValues.strictEquals(left, right));
                case "!==":
                    return BooleanNode.valueOf(!JsonValues.strictEquals(left, right));
                case ">":
                    return BooleanNode.valueOf(num(left) > num(right));
                case ">=":
                    return BooleanNode.valueOf(num(left) >= num(right));
                case "<":
                    return BooleanNode.valueOf(num(left) < num(right));
                case "<=":
                    return BooleanNode.valueOf(num(left) <= num(right));
                case "&&":
                    return JsonValues.isTruthy(left) ? right : left;
                case "||":
                    return JsonValues.isTruthy(left) ? left : right;
                default:
                    throw new IllegalStateException("Unknown binary operator: " + binary.op());
            }
        }

        private JsonNode unary(ExprNode.Unary unary) {
            JsonNode operand = visit(unary.operand());
            switch (unary.op()) {
                case "!":
                    return BooleanNode.valueOf(!JsonValues.isTruthy(operand));
                case "-": {
                    double d = JsonValues.toNumber(operand);
                    return JsonValues.number(Double.isNaN(d) ? 0 : -d);
                }
                default:
                    throw new IllegalStateException("Unknown unary operator: " + unary.op());
            }
        }
    }

    private static boolean isTextLike(JsonNode node) {
        return node != null && (node.isTextual() || node.isContainerNode());
    }

    private static double num(JsonNode node) {
        return JsonValues.toNumber(node);
    }

    private static JsonNode arithmetic(double value) {
        return JsonValues.number(Double.isNaN(value) ? 0 : value);
    }

    private static JsonNode orNull(JsonNode node) {
        return JsonValues.isUndefined(node) ? NODES.nullNode() : node;
    }
}
