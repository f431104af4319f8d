package io.screenbind.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Set;

/**
 * Read-only view that paths and expressions resolve against. Built fresh by the UI runtime for
 * each render pass or action dispatch.
 *
 * <p>
 * Only four roots are resolvable: {@code state}, {@code inputs}, {@code context} and
 * {@code trace_id}. Any other root resolves to {@link MissingNode} so that partially populated
 * screens keep rendering.
 *
 * <p>
 * The engine never mutates a context. {@code state} is held by reference, so mutators applied to
 * the same document are visible to the next render.
 */
public record BindingContext(ObjectNode state, ObjectNode inputs, ObjectNode context, String traceId) {

    public static final String STATE = "state";
    public static final String INPUTS = "inputs";
    public static final String CONTEXT = "context";
    public static final String TRACE_ID = "trace_id";

    /** The sanctioned root names. */
    public static final Set<String> ROOTS = Set.of(STATE, INPUTS, CONTEXT, TRACE_ID);

    public BindingContext {
        state = state != null ? state : JsonNodeFactory.instance.objectNode();
        inputs = inputs != null ? inputs : JsonNodeFactory.instance.objectNode();
        context = context != null ? context : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Resolves a root identifier.
     *
     * @return the namespace object, a text or null node for {@code trace_id}, or
     *         {@link MissingNode} for any other name
     */
    public JsonNode root(String name) {
        if (name == null) {
            return MissingNode.getInstance();
        }
        return switch (name) {
            case STATE -> state;
            case INPUTS -> inputs;
            case CONTEXT -> context;
            case TRACE_ID -> traceId != null
                    ? JsonNodeFactory.instance.textNode(traceId)
                    : JsonNodeFactory.instance.nullNode();
            default -> MissingNode.getInstance();
        };
    }

    /** True if {@code name} is one of the four sanctioned roots. */
    public static boolean isRoot(String name) {
        return name != null && ROOTS.contains(name);
    }

    /** A context over the given state with empty inputs and context and no trace id. */
    public static BindingContext of(ObjectNode state) {
        return new BindingContext(state, null, null, null);
    }

    /** A context with every namespace empty. */
    public static BindingContext empty() {
        return new BindingContext(null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder; unset namespaces default to empty objects. */
    public static final class Builder {

        private ObjectNode state;
        private ObjectNode inputs;
        private ObjectNode context;
        private String traceId;

        private Builder() {}

        public Builder state(ObjectNode state) {
            this.state = state;
            return this;
        }

        public Builder inputs(ObjectNode inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder context(ObjectNode context) {
            this.context = context;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public BindingContext build() {
            return new BindingContext(state, inputs, context, traceId);
        }
    }

    @Override
    public String toString() {
        // Values may hold user data; print key names only.
        return "BindingContext[state=" + fieldNames(state) + ", inputs=" + fieldNames(inputs) + ", context="
                + fieldNames(context) + ", traceId=" + traceId + "]";
    }

    private static String fieldNames(ObjectNode node) {
        StringBuilder sb = new StringBuilder("[");
        node.fieldNames().forEachRemaining(name -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(name);
        });
        return sb.append(']').toString();
    }
}
