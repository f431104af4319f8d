package io.screenbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.screenbind.core.error.BindingException;
import io.screenbind.core.expr.EvalOptions;
import io.screenbind.core.expr.ExpressionEvaluator;
import io.screenbind.core.expr.ExpressionParser;
import io.screenbind.core.model.BindingContext;
import io.screenbind.core.model.ExprNode;
import io.screenbind.core.model.PathSegment;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link BindingContext} to a schema fragment.
 *
 * <p>
 * A string that is exactly one {@code {{ ... }}} run returns the native value of the binding (any
 * JSON type). A string with embedded runs has each run's value coerced to text and spliced into the
 * surrounding literal. Arrays render element-wise, objects key-wise in order, and other values pass
 * through unchanged.
 *
 * <p>
 * Inner text containing any of {@code ()!?:+-*}{@code /<>=|&} is an expression and goes through the
 * parser and evaluator; anything else is a plain path. Rendering is total: a binding that fails to
 * tokenize, parse or evaluate renders as {@code null} (whole string) or {@code ""} (inline), and the
 * failure is logged at DEBUG.
 */
public final class TemplateRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateRenderer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Pattern WHOLE = Pattern.compile("^\\{\\{\\s*([^{}]+?)\\s*\\}\\}$");
    private static final Pattern INLINE = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*\\}\\}");
    private static final String EXPRESSION_CHARS = "()!?:+-*/<>=|&";

    private final ExpressionParser parser;
    private final EvalOptions options;

    public TemplateRenderer() {
        this(new ExpressionParser(), EvalOptions.DEFAULT);
    }

    public TemplateRenderer(ExpressionParser parser, EvalOptions options) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Renders {@code template} against {@code context}. Never throws for malformed bindings.
     *
     * @return the rendered tree; a Java {@code null} template renders as {@link NullNode}
     */
    public JsonNode render(JsonNode template, BindingContext context) {
        if (template == null) {
            return NullNode.getInstance();
        }
        BindingContext ctx = context != null ? context : BindingContext.empty();
        return renderNode(template, ctx);
    }

    /** Renders a plain Java value (maps, lists, strings, numbers) after converting it with Jackson. */
    public JsonNode render(Object template, BindingContext context) {
        if (template instanceof JsonNode node) {
            return render(node, context);
        }
        return render(template == null ? null : MAPPER.<JsonNode>valueToTree(template), context);
    }

    /**
     * Renders a single string.
     *
     * @return the native value for a whole-string binding, otherwise a text node
     */
    public JsonNode renderString(String text, BindingContext context) {
        BindingContext ctx = context != null ? context : BindingContext.empty();
        return renderText(text, ctx);
    }

    private JsonNode renderNode(JsonNode node, BindingContext ctx) {
        if (node.isTextual()) {
            return renderText(node.asText(), ctx);
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode(node.size());
            for (JsonNode element : node) {
                out.add(renderNode(element, ctx));
            }
            return out;
        }
        if (node.isObject()) {
            ObjectNode out = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), renderNode(field.getValue(), ctx));
            }
            return out;
        }
        return node;
    }

    private JsonNode renderText(String text, BindingContext ctx) {
        if (text == null || !text.contains("{{")) {
            return JsonValues.text(text);
        }
        Matcher whole = WHOLE.matcher(text);
        if (whole.matches()) {
            JsonNode value = resolveBinding(whole.group(1).trim(), ctx);
            if (JsonValues.isUndefined(value)) {
                return NullNode.getInstance();
            }
            // Detached so that edits to the rendered tree cannot reach state.
            return value.isContainerNode() ? value.deepCopy() : value;
        }
        Matcher inline = INLINE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (inline.find()) {
            String replacement = JsonValues.toText(resolveBinding(inline.group(1).trim(), ctx));
            inline.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        inline.appendTail(sb);
        return JsonValues.text(sb.toString());
    }

    private JsonNode resolveBinding(String inner, BindingContext ctx) {
        if (!isExpression(inner)) {
            return resolvePath(inner, ctx);
        }
        try {
            ExprNode ast = parser.parse(inner);
            return ExpressionEvaluator.evaluate(ast, ctx, options, inner);
        } catch (BindingException e) {
            LOG.debug("Binding '{}' rendered as default: {} ({})", inner, e.getMessage(), e.phase());
            return MissingNode.getInstance();
        }
    }

    /**
     * Resolves a plain path: the first segment selects a context root, the rest walk into it.
     */
    static JsonNode resolvePath(String path, BindingContext ctx) {
        List<PathSegment> segments = PathResolver.parse(path);
        if (segments.isEmpty()) {
            return MissingNode.getInstance();
        }
        JsonNode root = ctx.root(segments.get(0).name());
        return PathResolver.get(root, segments.subList(1, segments.size()));
    }

    /** True if the inner text of a binding is an expression rather than a plain path. */
    public static boolean isExpression(String inner) {
        if (inner == null) {
            return false;
        }
        for (int i = 0; i < inner.length(); i++) {
            if (EXPRESSION_CHARS.indexOf(inner.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lists the distinct inner texts of every {@code {{ ... }}} run in {@code template}, in
     * encounter order (object values in key order, arrays by index).
     */
    public static List<String> collectBindings(JsonNode template) {
        Set<String> found = new LinkedHashSet<>();
        collect(template, found);
        return new ArrayList<>(found);
    }

    private static void collect(JsonNode node, Set<String> found) {
        if (node == null) {
            return;
        }
        if (node.isTextual()) {
            Matcher m = INLINE.matcher(node.asText());
            while (m.find()) {
                found.add(m.group(1).trim());
            }
        } else if (node.isContainerNode()) {
            for (JsonNode child : node) {
                collect(child, found);
            }
        }
    }
}
