package io.screenbind.core.expr;

import com.fasterxml.jackson.databind.JsonNode;
import io.screenbind.core.engine.BindingGraph;
import io.screenbind.core.engine.TemplateRenderer;
import io.screenbind.core.error.ExpressionParseException;
import io.screenbind.core.function.SafeFunctions;
import io.screenbind.core.model.BindingContext;
import io.screenbind.core.model.ExprNode;
import io.screenbind.core.model.ValidationIssue;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Authoring-time checks for binding expressions, run before a screen schema is stored.
 *
 * <p>
 * Every method returns a list of {@link ValidationIssue}s and never throws; an empty list means
 * the input is clean. Issue types:
 * <ul>
 * <li>{@code syntax}: the expression fails to tokenize or parse</li>
 * <li>{@code unknown-function}: a call outside the allow-list</li>
 * <li>{@code invalid-source}: a path root other than {@code state}, {@code inputs},
 * {@code context} or {@code trace_id}</li>
 * <li>{@code missing-path}: a bare {@code state}, {@code inputs} or {@code context} root</li>
 * <li>{@code uncommon-context} (warning): a {@code context} key outside the well-known set</li>
 * <li>{@code empty-expression}, {@code empty-target}, {@code circular-dependency}</li>
 * </ul>
 */
public final class ExpressionValidator {

    /** Context keys the UI runtime is known to populate. */
    public static final Set<String> KNOWN_CONTEXT_KEYS = Set.of("user_id", "user_email", "tenant_id", "permissions");

    private static final String KNOWN_CONTEXT_LIST =
            String.join(", ", KNOWN_CONTEXT_KEYS.stream().sorted().toList());

    private final Set<String> allowedFunctions;
    private final ExpressionParser parser;

    /** Validates against the built-in function names and default limits. */
    public ExpressionValidator() {
        this(SafeFunctions.table().names(), new ExpressionParser());
    }

    public ExpressionValidator(Set<String> allowedFunctions, ExpressionParser parser) {
        this.allowedFunctions = Set.copyOf(Objects.requireNonNull(allowedFunctions, "allowedFunctions must not be null"));
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /** Validates one expression; surrounding {@code {{ }}} is optional. */
    public List<ValidationIssue> validate(String expression) {
        String body = unwrap(expression);
        if (body.isEmpty()) {
            return List.of(ValidationIssue.error("empty-expression", "Binding expression is empty"));
        }
        ExprNode ast;
        try {
            ast = parser.parse(body);
        } catch (ExpressionParseException e) {
            return List.of(ValidationIssue.error("syntax", e.getMessage()));
        }
        Set<ValidationIssue> issues = new LinkedHashSet<>();
        for (String name : AstInspector.collectFunctions(ast)) {
            if (!allowedFunctions.contains(name)) {
                issues.add(ValidationIssue.error("unknown-function", "Unknown function: '" + name + "'"));
            }
        }
        for (String path : AstInspector.collectPaths(ast)) {
            checkPath(path, issues);
        }
        return new ArrayList<>(issues);
    }

    /** Validates a plain source path such as {@code inputs.device_id}; no expression syntax. */
    public List<ValidationIssue> validatePath(String path) {
        String body = unwrap(path);
        if (body.isEmpty()) {
            return List.of(ValidationIssue.error("empty-expression", "Binding expression is empty"));
        }
        Set<ValidationIssue> issues = new LinkedHashSet<>();
        checkPath(body, issues);
        return new ArrayList<>(issues);
    }

    /** Validates every {@code {{ ... }}} run found in a template. */
    public List<ValidationIssue> validateTemplate(JsonNode template) {
        Set<ValidationIssue> issues = new LinkedHashSet<>();
        for (String binding : TemplateRenderer.collectBindings(template)) {
            issues.addAll(TemplateRenderer.isExpression(binding) ? validate(binding) : validatePath(binding));
        }
        return new ArrayList<>(issues);
    }

    /**
     * Validates a bindings map (target path to source path): cycles, empty targets, and each
     * source as a plain path.
     */
    public List<ValidationIssue> validateBindings(Map<String, String> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return List.of();
        }
        Set<ValidationIssue> issues = new LinkedHashSet<>();
        for (String cycle : BindingGraph.detectCycles(bindings)) {
            issues.add(ValidationIssue.error("circular-dependency", "Circular binding dependency detected: " + cycle));
        }
        for (Map.Entry<String, String> binding : bindings.entrySet()) {
            if (binding.getKey() == null || binding.getKey().isBlank()) {
                issues.add(ValidationIssue.error("empty-target", "Binding target must be a non-empty path"));
            }
            issues.addAll(validatePath(binding.getValue()));
        }
        return new ArrayList<>(issues);
    }

    public Set<String> allowedFunctions() {
        return allowedFunctions;
    }

    private static void checkPath(String path, Set<ValidationIssue> issues) {
        String[] parts = path.split("[.\\[]", 2);
        String root = parts[0].trim();
        if (!BindingContext.isRoot(root)) {
            issues.add(ValidationIssue.error(
                    "invalid-source",
                    "Invalid binding source: '" + root + "'. Must be one of: state, inputs, context, trace_id"));
            return;
        }
        if (parts.length == 1 || parts[1].isBlank()) {
            if (!BindingContext.TRACE_ID.equals(root)) {
                issues.add(ValidationIssue.error(
                        "missing-path", "Binding source '" + root + "' requires a path (e.g. " + root + ".id)"));
            }
            return;
        }
        if (BindingContext.CONTEXT.equals(root)) {
            String key = parts[1].split("[.\\[\\]]", 2)[0];
            if (!KNOWN_CONTEXT_KEYS.contains(key)) {
                issues.add(ValidationIssue.warning(
                        "uncommon-context", "Context path '" + key + "' is uncommon. Known keys: " + KNOWN_CONTEXT_LIST));
            }
        }
    }

    private static String unwrap(String expression) {
        if (expression == null) {
            return "";
        }
        String s = expression.trim();
        if (s.startsWith("{{") && s.endsWith("}}") && s.length() >= 4) {
            s = s.substring(2, s.length() - 2).trim();
        }
        return s;
    }
}
