package io.screenbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.screenbind.core.model.BindingContext;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-place updates to a screen's {@code state} document.
 *
 * <p>
 * Action bookkeeping lives in three reserved maps on the state root:
 * <ul>
 * <li>{@code results[actionId]}: the last result of the action</li>
 * <li>{@code __loading[actionId]}: whether the action is in flight</li>
 * <li>{@code __error[actionId]}: the last error message, or {@code null}</li>
 * </ul>
 * A reserved key holding something other than an object is replaced with an empty object before
 * it is written to.
 *
 * <p>
 * Not synchronised: callers must not mutate the same state from several threads.
 */
public final class BindingMutators {

    private static final Logger LOG = LoggerFactory.getLogger(BindingMutators.class);

    public static final String RESULTS = "results";
    public static final String LOADING = "__loading";
    public static final String ERROR = "__error";
    public static final String STATE_PATCH = "state_patch";

    private static final String STATE_PREFIX = BindingContext.STATE + ".";

    private BindingMutators() {}

    /**
     * Copies values from the context into {@code state}. Each entry maps a target path in state
     * to a plain source path such as {@code inputs.device_id}; a surrounding {@code {{ }}} on the
     * source and a leading {@code state.} on the target are stripped. An unresolvable source writes
     * {@code null}. No expression evaluation takes place. Uses the default limits.
     */
    public static void applyBindings(ObjectNode state, Map<String, String> bindings, BindingContext context) {
        applyBindings(state, bindings, context, EngineLimits.DEFAULT);
    }

    /**
     * As {@link #applyBindings(ObjectNode, Map, BindingContext)}; a target addressing an array
     * slot at or beyond {@code limits.maxArrayElements()} is skipped and leaves state untouched.
     */
    public static void applyBindings(
            ObjectNode state, Map<String, String> bindings, BindingContext context, EngineLimits limits) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        if (bindings == null || bindings.isEmpty()) {
            return;
        }
        BindingContext ctx = context != null ? context : BindingContext.of(state);
        for (Map.Entry<String, String> binding : bindings.entrySet()) {
            String target = stripStatePrefix(binding.getKey());
            if (target.isEmpty()) {
                continue;
            }
            JsonNode value = TemplateRenderer.resolvePath(stripBraces(binding.getValue()), ctx);
            PathResolver.set(
                    state,
                    target,
                    JsonValues.isUndefined(value) ? NullNode.getInstance() : value.deepCopy(),
                    limits.maxArrayElements());
        }
    }

    /**
     * Records {@code result} under {@code results[actionId]}. When the result is an object with an
     * object-valued {@code state_patch}, every patch key is written into state at the top level;
     * dotted keys address nested paths. Uses the default limits.
     */
    public static void applyActionResultToState(ObjectNode state, String actionId, JsonNode result) {
        applyActionResultToState(state, actionId, result, EngineLimits.DEFAULT);
    }

    /** As {@link #applyActionResultToState(ObjectNode, String, JsonNode)} with an explicit array cap. */
    public static void applyActionResultToState(
            ObjectNode state, String actionId, JsonNode result, EngineLimits limits) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(actionId, "actionId must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        JsonNode stored = JsonValues.isUndefined(result) ? NullNode.getInstance() : result;
        reserved(state, RESULTS).set(actionId, stored);

        JsonNode patch = stored.path(STATE_PATCH);
        if (!patch.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            PathResolver.set(state, field.getKey(), field.getValue().deepCopy(), limits.maxArrayElements());
        }
        LOG.debug("Merged state_patch for action '{}': {} key(s)", actionId, patch.size());
    }

    public static void setLoading(ObjectNode state, String actionId, boolean loading) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(actionId, "actionId must not be null");
        reserved(state, LOADING).set(actionId, BooleanNode.valueOf(loading));
    }

    /** Sets or clears ({@code null}) the error message for an action. */
    public static void setError(ObjectNode state, String actionId, String message) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(actionId, "actionId must not be null");
        reserved(state, ERROR)
                .set(actionId, message != null ? TextNode.valueOf(message) : NullNode.getInstance());
    }

    /** True only if {@code __loading[actionId]} is {@code true}. */
    public static boolean isLoading(JsonNode state, String actionId) {
        return state != null && state.path(LOADING).path(actionId).asBoolean(false);
    }

    /** The message in {@code __error[actionId]}, or empty when unset or cleared. */
    public static Optional<String> errorOf(JsonNode state, String actionId) {
        if (state == null) {
            return Optional.empty();
        }
        JsonNode message = state.path(ERROR).path(actionId);
        return message.isTextual() ? Optional.of(message.asText()) : Optional.empty();
    }

    private static ObjectNode reserved(ObjectNode state, String key) {
        JsonNode existing = state.get(key);
        if (existing instanceof ObjectNode object) {
            return object;
        }
        return state.putObject(key);
    }

    static String stripBraces(String source) {
        if (source == null) {
            return "";
        }
        String s = source.trim();
        if (s.startsWith("{{") && s.endsWith("}}") && s.length() >= 4) {
            s = s.substring(2, s.length() - 2).trim();
        }
        return s;
    }

    static String stripStatePrefix(String target) {
        if (target == null) {
            return "";
        }
        String t = target.trim();
        return t.startsWith(STATE_PREFIX) ? t.substring(STATE_PREFIX.length()) : t;
    }
}
