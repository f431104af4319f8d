package io.screenbind.core.function;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.screenbind.core.engine.JsonValues;
import java.util.ArrayList;
import java.util.List;

/**
 * Lenient argument coercions used by the safe functions. Unlike {@link JsonValues#toNumber},
 * these never yield NaN: anything unreadable becomes {@code 0}, {@code ""} or an empty list.
 */
final class Coercions {

    private Coercions() {}

    /** The i-th argument, or {@link MissingNode} when absent. */
    static JsonNode arg(List<JsonNode> args, int i) {
        if (i < args.size()) {
            JsonNode value = args.get(i);
            return value != null ? value : MissingNode.getInstance();
        }
        return MissingNode.getInstance();
    }

    static double toNum(JsonNode node) {
        double d = JsonValues.toNumber(node);
        return Double.isNaN(d) ? 0 : d;
    }

    static String toStr(JsonNode node) {
        return JsonValues.toText(node);
    }

    /** The first {@code cap} elements of an array; any other input is an empty list. */
    static List<JsonNode> toArr(JsonNode node, int cap) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        int size = Math.min(node.size(), cap);
        List<JsonNode> out = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            out.add(node.get(i));
        }
        return out;
    }

    /** Reads {@code field} from each object element; non-objects and absent fields are undefined. */
    static List<JsonNode> pluck(List<JsonNode> items, String field) {
        List<JsonNode> out = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            out.add(field(item, field));
        }
        return out;
    }

    static JsonNode field(JsonNode item, String field) {
        if (item != null && item.isObject()) {
            JsonNode value = item.get(field);
            return value != null ? value : MissingNode.getInstance();
        }
        return MissingNode.getInstance();
    }

    /** Integer truncation toward zero, clamped to the int range. */
    static int toInt(JsonNode node) {
        double d = toNum(node);
        if (d >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (d <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) d;
    }
}
