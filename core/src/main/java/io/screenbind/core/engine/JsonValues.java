package io.screenbind.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Shared value semantics for binding expressions: truthiness, number and string coercion, and the
 * two equality relations. {@link com.fasterxml.jackson.databind.node.MissingNode} plays the role
 * of "undefined" throughout.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class JsonValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private JsonValues() {}

    /** True for Java {@code null} and {@code MissingNode}. */
    public static boolean isUndefined(JsonNode node) {
        return node == null || node.isMissingNode();
    }

    /** True for undefined and {@code NullNode}. */
    public static boolean isNullish(JsonNode node) {
        return isUndefined(node) || node.isNull();
    }

    /**
     * Determines if a value is truthy.
     *
     * <ul>
     * <li>undefined, {@code NullNode} → falsy</li>
     * <li>{@code BooleanNode} → its value</li>
     * <li>numbers → falsy when zero or NaN</li>
     * <li>{@code TextNode("")} → falsy</li>
     * <li>objects and arrays, even empty → truthy</li>
     * </ul>
     */
    public static boolean isTruthy(JsonNode node) {
        if (isNullish(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double d = node.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        return true;
    }

    /**
     * Wraps a double in the narrowest numeric node: integral values become {@code IntNode} or
     * {@code LongNode} so that {@code 2 + 3} renders as {@code 5}.
     */
    public static JsonNode number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
            return DoubleNode.valueOf(value);
        }
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return IntNode.valueOf((int) value);
        }
        if (value >= Long.MIN_VALUE && value <= Long.MAX_VALUE) {
            return LongNode.valueOf((long) value);
        }
        return DoubleNode.valueOf(value);
    }

    /**
     * Numeric coercion. Strings are trimmed and parsed as decimal or hex literals (empty means
     * {@code 0}); booleans are {@code 1}/{@code 0}; null is {@code 0}; an array reads as its only
     * element. Anything that cannot be read is {@code NaN}.
     */
    public static double toNumber(JsonNode node) {
        if (isUndefined(node)) {
            return Double.NaN;
        }
        if (node.isNull()) {
            return 0;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1 : 0;
        }
        if (node.isTextual()) {
            return parseNumber(node.asText());
        }
        if (node.isArray()) {
            if (node.isEmpty()) {
                return 0;
            }
            return node.size() == 1 ? parseNumber(toText(node.get(0))) : Double.NaN;
        }
        return Double.NaN;
    }

    static double parseNumber(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            return 0;
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (HEX.matcher(text).matches()) {
            try {
                return Long.parseLong(text.substring(2), 16);
            } catch (NumberFormatException e) {
                return new BigInteger(text.substring(2), 16).doubleValue();
            }
        }
        return switch (text) {
            case "Infinity", "+Infinity" -> Double.POSITIVE_INFINITY;
            case "-Infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.NaN;
        };
    }

    /**
     * String coercion. Undefined and null become {@code ""}; numbers print without a trailing
     * {@code .0}; objects and arrays print as compact JSON.
     */
    public static String toText(JsonNode node) {
        if (isNullish(node)) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isNumber()) {
            return formatNumber(node.doubleValue());
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "true" : "false";
        }
        return node.toString();
    }

    /** Formats a double the way the expression language prints numbers. */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            return new BigDecimal(d).toPlainString();
        }
        String s = Double.toString(d);
        int e = s.indexOf('E');
        if (e < 0) {
            return s;
        }
        String mantissa = s.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        String exponent = s.substring(e + 1);
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }

    /** Convenience for building text results. */
    public static JsonNode text(String value) {
        return TextNode.valueOf(value != null ? value : "");
    }

    /**
     * Loose equality ({@code ==}). Null and undefined equal each other and nothing else; a
     * boolean is compared as a number; a number against a string compares numerically; an
     * object or array against a scalar compares by its string form.
     */
    public static boolean looseEquals(JsonNode left, JsonNode right) {
        if (isNullish(left) || isNullish(right)) {
            return isNullish(left) && isNullish(right);
        }
        if (left.isBoolean()) {
            return looseEquals(number(toNumber(left)), right);
        }
        if (right.isBoolean()) {
            return looseEquals(left, number(toNumber(right)));
        }
        if (left.isNumber() && right.isNumber()) {
            return left.doubleValue() == right.doubleValue();
        }
        if (left.isTextual() && right.isTextual()) {
            return left.asText().equals(right.asText());
        }
        if ((left.isNumber() && right.isTextual()) || (left.isTextual() && right.isNumber())) {
            return toNumber(left) == toNumber(right);
        }
        if (left.isContainerNode() && right.isContainerNode()) {
            return left.equals(right);
        }
        if (left.isContainerNode()) {
            return looseEquals(TextNode.valueOf(toText(left)), right);
        }
        if (right.isContainerNode()) {
            return looseEquals(left, TextNode.valueOf(toText(right)));
        }
        return left.equals(right);
    }

    /**
     * Strict equality ({@code ===}). Both sides must have the same kind; numbers compare by value
     * regardless of node class; null and undefined are distinct.
     */
    public static boolean strictEquals(JsonNode left, JsonNode right) {
        if (isUndefined(left) || isUndefined(right)) {
            return isUndefined(left) && isUndefined(right);
        }
        if (left.isNumber() && right.isNumber()) {
            return left.doubleValue() == right.doubleValue();
        }
        if (left.getNodeType() != right.getNodeType()) {
            return false;
        }
        return left.equals(right);
    }
}
