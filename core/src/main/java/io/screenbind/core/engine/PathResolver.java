package io.screenbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ContainerNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.screenbind.core.model.PathSegment;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes dot-paths such as {@code items[0].name} or {@code rows.2.cells.1}.
 *
 * <p>
 * A bracketed index and a purely numeric dot segment are the same thing: {@code items.0.name} and
 * {@code items[0].name} address the same value. Whether a segment is used as an object key or an
 * array slot is decided by the container it meets at runtime.
 *
 * <p>
 * {@link #set} is the single mutation path into binding state. Thread-safe: stateless utility
 * class; callers own synchronisation of the documents they pass in.
 */
public final class PathResolver {

    private static final Logger LOG = LoggerFactory.getLogger(PathResolver.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private PathResolver() {}

    /**
     * Splits a path into segments. Empty segments are dropped, bracket contents are trimmed and
     * may be quoted ({@code a['b c']}).
     */
    public static List<PathSegment> parse(String path) {
        List<PathSegment> segments = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return segments;
        }
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                flush(current, segments);
                i++;
            } else if (c == '[') {
                flush(current, segments);
                int close = path.indexOf(']', i + 1);
                if (close < 0) {
                    // Unclosed bracket: treat the remainder as one segment.
                    current.append(path, i + 1, path.length());
                    i = path.length();
                } else {
                    current.append(unquote(path.substring(i + 1, close).trim()));
                    flush(current, segments);
                    i = close + 1;
                }
            } else {
                current.append(c);
                i++;
            }
        }
        flush(current, segments);
        return segments;
    }

    /**
     * Resolves {@code path} against {@code container}.
     *
     * @return the value, or {@link MissingNode} as soon as a missing, null or scalar intermediate
     *         is met; never throws
     */
    public static JsonNode get(JsonNode container, String path) {
        return get(container, parse(path));
    }

    /** Resolves pre-parsed segments; an empty list returns the container itself. */
    public static JsonNode get(JsonNode container, List<PathSegment> segments) {
        JsonNode current = container != null ? container : MissingNode.getInstance();
        for (PathSegment segment : segments) {
            current = child(current, segment);
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    /** Resolves a path given as plain string segments, as held by an expression path node. */
    public static JsonNode getSegments(JsonNode container, List<String> segments) {
        JsonNode current = container != null ? container : MissingNode.getInstance();
        for (String name : segments) {
            current = child(current, new PathSegment(name));
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate containers as needed. An
     * intermediate that is missing or of the wrong shape is replaced: with an array when the next
     * segment is an index, otherwise with an object. Index writes past the end pad with nulls. An
     * empty path is a no-op. Array slots are capped at {@link EngineLimits#DEFAULT_MAX_ARRAY_ELEMENTS}.
     *
     * @return {@code true} if the value was written
     */
    public static boolean set(ObjectNode root, String path, JsonNode value) {
        return set(root, parse(path), value, EngineLimits.DEFAULT_MAX_ARRAY_ELEMENTS);
    }

    /**
     * Variant of {@link #set(ObjectNode, String, JsonNode)} with an explicit array cap. A write
     * that would address an array slot at or beyond {@code maxArrayElements} is rejected before
     * anything is touched: {@code root} is left exactly as it was.
     *
     * @return {@code true} if the value was written, {@code false} for an empty path, a null
     *         root or a rejected index
     */
    public static boolean set(ObjectNode root, String path, JsonNode value, int maxArrayElements) {
        return set(root, parse(path), value, maxArrayElements);
    }

    /** Pre-parsed variant of {@link #set(ObjectNode, String, JsonNode, int)}. */
    public static boolean set(ObjectNode root, List<PathSegment> segments, JsonNode value, int maxArrayElements) {
        if (root == null || segments.isEmpty()) {
            return false;
        }
        PathSegment rejected = overCapIndex(root, segments, maxArrayElements);
        if (rejected != null) {
            LOG.warn(
                    "Ignoring write to '{}': index {} exceeds array cap of {}",
                    join(segments),
                    rejected,
                    maxArrayElements);
            return false;
        }
        JsonNode stored = value != null ? value : NullNode.getInstance();
        ContainerNode<?> current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            PathSegment segment = segments.get(i);
            boolean nextIsIndex = segments.get(i + 1).isIndex();
            JsonNode existing = child(current, segment);
            ContainerNode<?> next;
            if (nextIsIndex && existing.isContainerNode()) {
                next = (ContainerNode<?>) existing;
            } else if (nextIsIndex) {
                next = NODES.arrayNode();
            } else if (existing.isObject()) {
                next = (ObjectNode) existing;
            } else {
                next = NODES.objectNode();
            }
            if (next != existing) {
                put(current, segment, next);
            }
            current = next;
        }
        put(current, segments.get(segments.size() - 1), stored);
        return true;
    }

    /**
     * Dry run of the container walk in {@code set}: the first segment that would land on an
     * array slot outside {@code [0, maxArrayElements)}, or {@code null}. A segment lands on an
     * array when it is an index and the node before it is not an object; missing or scalar
     * nodes become fresh arrays.
     */
    private static PathSegment overCapIndex(ObjectNode root, List<PathSegment> segments, int maxArrayElements) {
        JsonNode existing = root;
        for (int i = 1; i < segments.size(); i++) {
            existing = child(existing, segments.get(i - 1));
            PathSegment segment = segments.get(i);
            if (segment.isIndex() && !existing.isObject()) {
                int index = segment.index();
                if (index < 0 || index >= maxArrayElements) {
                    return segment;
                }
            }
        }
        return null;
    }

    private static JsonNode child(JsonNode node, PathSegment segment) {
        if (node == null) {
            return MissingNode.getInstance();
        }
        if (node.isObject()) {
            JsonNode value = node.get(segment.name());
            return value != null ? value : MissingNode.getInstance();
        }
        if (node.isArray()) {
            int index = segment.index();
            if (index >= 0 && index < node.size()) {
                return node.get(index);
            }
        }
        return MissingNode.getInstance();
    }

    private static void put(ContainerNode<?> container, PathSegment segment, JsonNode value) {
        if (container instanceof ObjectNode object) {
            object.set(segment.name(), value);
            return;
        }
        ArrayNode array = (ArrayNode) container;
        if (!segment.isIndex()) {
            // Arrays are only kept or created when the segment that addresses them is an index.
            throw new IllegalStateException("Non-index segment '" + segment + "' on array");
        }
        int index = segment.index();
        while (array.size() <= index) {
            array.addNull();
        }
        array.set(index, value);
    }

    private static String join(List<PathSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment.name());
        }
        return sb.toString();
    }

    private static void flush(StringBuilder current, List<PathSegment> segments) {
        if (current.length() > 0) {
            segments.add(new PathSegment(current.toString()));
            current.setLength(0);
        }
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }
}
