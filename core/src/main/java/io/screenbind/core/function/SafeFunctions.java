package io.screenbind.core.function;

import static io.screenbind.core.function.Coercions.arg;
import static io.screenbind.core.function.Coercions.pluck;
import static io.screenbind.core.function.Coercions.toArr;
import static io.screenbind.core.function.Coercions.toInt;
import static io.screenbind.core.function.Coercions.toNum;
import static io.screenbind.core.function.Coercions.toStr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.engine.JsonValues;
import io.screenbind.core.model.FunctionSignature;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * The safe function library: the closed whitelist of functions reachable from binding
 * expressions.
 *
 * <p>
 * Every function is total. Strings are produced from any input ({@code null}/undefined become
 * {@code ""}); non-numeric input reads as {@code 0}; non-array input to a collection function is an
 * empty array, and array input is truncated to the configured element cap before any work is
 * done. Coercions are deliberately loose: {@code sum} over a non-numeric field contributes
 * {@code 0} rather than failing, and persisted screens rely on that.
 *
 * <p>
 * Thread-safe: tables are immutable and functions stateless.
 */
public final class SafeFunctions {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private static final FunctionTable DEFAULT_TABLE =
            new SafeFunctions(EngineLimits.DEFAULT_MAX_ARRAY_ELEMENTS, Clock.systemUTC()).toTable();

    private static final Map<String, FunctionSignature> SIGNATURES = buildSignatures();

    private final int maxArrayElements;
    private final Clock clock;

    private SafeFunctions(int maxArrayElements, Clock clock) {
        if (maxArrayElements <= 0) {
            throw new IllegalArgumentException("maxArrayElements must be positive, got: " + maxArrayElements);
        }
        this.maxArrayElements = maxArrayElements;
        this.clock = clock;
    }

    /** The default table: 10,000-element cap, system UTC clock. */
    public static FunctionTable table() {
        return DEFAULT_TABLE;
    }

    /** A table whose collection functions truncate at {@code maxArrayElements}. */
    public static FunctionTable table(int maxArrayElements) {
        return table(maxArrayElements, Clock.systemUTC());
    }

    /** A table with an explicit clock for {@code now()} (tests). */
    public static FunctionTable table(int maxArrayElements, Clock clock) {
        if (clock == null) {
            throw new NullPointerException("clock must not be null");
        }
        return new SafeFunctions(maxArrayElements, clock).toTable();
    }

    /**
     * Published signatures for editor help and autocomplete, in library order. Descriptive only.
     */
    public static Map<String, FunctionSignature> signatures() {
        return SIGNATURES;
    }

    private FunctionTable toTable() {
        return FunctionTable.builder()
                // String
                .register("uppercase", args -> text(toStr(arg(args, 0)).toUpperCase(Locale.ROOT)))
                .register("lowercase", args -> text(toStr(arg(args, 0)).toLowerCase(Locale.ROOT)))
                .register("trim", args -> text(toStr(arg(args, 0)).strip()))
                .register("substring", SafeFunctions::substring)
                .register("includes", args -> bool(toStr(arg(args, 0)).contains(toStr(arg(args, 1)))))
                .register("startsWith", args -> bool(toStr(arg(args, 0)).startsWith(toStr(arg(args, 1)))))
                .register("endsWith", args -> bool(toStr(arg(args, 0)).endsWith(toStr(arg(args, 1)))))
                .register("replace", SafeFunctions::replace)
                .register("split", SafeFunctions::split)
                .register("join", this::join)
                .register("length", SafeFunctions::length)
                // Number
                .register("round", SafeFunctions::round)
                .register("ceil", args -> JsonValues.number(Math.ceil(toNum(arg(args, 0)))))
                .register("floor", args -> JsonValues.number(Math.floor(toNum(arg(args, 0)))))
                .register("abs", args -> JsonValues.number(Math.abs(toNum(arg(args, 0)))))
                // Date
                .register("now", args -> text(ISO_MILLIS.format(clock.instant())))
                .register("formatDate", SafeFunctions::formatDate)
                // Collection
                .register("sum", args -> JsonValues.number(sum(args)))
                .register("avg", this::avg)
                .register("min", args -> extreme(args, true))
                .register("max", args -> extreme(args, false))
                .register("count", args -> JsonValues.number(array(args).size()))
                .register("first", this::first)
                .register("last", this::last)
                .register("unique", this::unique)
                .register("filter", this::filter)
                .register("map", this::map)
                // Utility
                .register("coalesce", SafeFunctions::coalesce)
                .register("ifElse", args -> JsonValues.isTruthy(arg(args, 0)) ? arg(args, 1) : arg(args, 2))
                .register("toString", args -> text(toStr(arg(args, 0))))
                .register("toNumber", args -> JsonValues.number(toNum(arg(args, 0))))
                .register("formatNumber", SafeFunctions::formatNumber)
                .build();
    }

    // --- String ---

    private static JsonNode substring(List<JsonNode> args) {
        String s = toStr(arg(args, 0));
        int len = s.length();
        int start = clamp(toInt(arg(args, 1)), len);
        JsonNode endArg = arg(args, 2);
        int end = JsonValues.isNullish(endArg) ? len : clamp(toInt(endArg), len);
        return text(s.substring(Math.min(start, end), Math.max(start, end)));
    }

    private static JsonNode replace(List<JsonNode> args) {
        String s = toStr(arg(args, 0));
        String search = toStr(arg(args, 1));
        int at = s.indexOf(search);
        if (at < 0) {
            return text(s);
        }
        return text(s.substring(0, at) + toStr(arg(args, 2)) + s.substring(at + search.length()));
    }

    private static JsonNode split(List<JsonNode> args) {
        String s = toStr(arg(args, 0));
        String sep = toStr(arg(args, 1));
        ArrayNode out = NODES.arrayNode();
        if (sep.isEmpty()) {
            for (int i = 0; i < s.length(); i++) {
                out.add(String.valueOf(s.charAt(i)));
            }
            return out;
        }
        int from = 0;
        int at;
        while ((at = s.indexOf(sep, from)) >= 0) {
            out.add(s.substring(from, at));
            from = at + sep.length();
        }
        out.add(s.substring(from));
        return out;
    }

    private JsonNode join(List<JsonNode> args) {
        String sep = toStr(arg(args, 1));
        StringBuilder sb = new StringBuilder();
        List<JsonNode> items = array(args);
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(sep);
            }
            sb.append(toStr(items.get(i)));
        }
        return text(sb.toString());
    }

    private static JsonNode length(List<JsonNode> args) {
        JsonNode value = arg(args, 0);
        if (value.isArray()) {
            return JsonValues.number(value.size());
        }
        return JsonValues.number(toStr(value).length());
    }

    // --- Number ---

    private static JsonNode round(List<JsonNode> args) {
        JsonNode decimalsArg = arg(args, 1);
        double decimals = JsonValues.isNullish(decimalsArg) ? 0 : toNum(decimalsArg);
        double factor = Math.pow(10, decimals);
        double scaled = Math.floor(toNum(arg(args, 0)) * factor + 0.5);
        return JsonValues.number(scaled / factor);
    }

    private static JsonNode formatNumber(List<JsonNode> args) {
        double n = toNum(arg(args, 0));
        JsonNode decimalsArg = arg(args, 1);
        int decimals = JsonValues.isNullish(decimalsArg) ? 0 : Math.max(0, Math.min(100, toInt(decimalsArg)));
        if (Double.isInfinite(n) || Math.abs(n) >= 1e21) {
            return text(JsonValues.formatNumber(n));
        }
        return text(new BigDecimal(n).setScale(decimals, RoundingMode.HALF_UP).toPlainString());
    }

    // --- Date ---

    private static JsonNode formatDate(List<JsonNode> args) {
        JsonNode date = arg(args, 0);
        ZonedDateTime parsed = parseDate(date);
        if (parsed == null) {
            return text(toStr(date));
        }
        String out = toStr(arg(args, 1));
        out = replaceFirst(out, "YYYY", String.valueOf(parsed.getYear()));
        out = replaceFirst(out, "MM", pad(parsed.getMonthValue()));
        out = replaceFirst(out, "DD", pad(parsed.getDayOfMonth()));
        out = replaceFirst(out, "HH", pad(parsed.getHour()));
        out = replaceFirst(out, "mm", pad(parsed.getMinute()));
        out = replaceFirst(out, "ss", pad(parsed.getSecond()));
        return text(out);
    }

    /** Accepts epoch millis, ISO instants, offset and local date-times, and plain dates. */
    private static ZonedDateTime parseDate(JsonNode date) {
        if (date.isNumber()) {
            double millis = date.doubleValue();
            if (Double.isNaN(millis) || Double.isInfinite(millis)) {
                return null;
            }
            return Instant.ofEpochMilli((long) millis).atZone(ZoneOffset.UTC);
        }
        if (!date.isTextual()) {
            return null;
        }
        String raw = date.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        ZonedDateTime parsed = tryParse(raw, text -> Instant.parse(text).atZone(ZoneOffset.UTC));
        if (parsed == null) {
            parsed = tryParse(raw, text -> OffsetDateTime.parse(text).atZoneSameInstant(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(raw, text -> LocalDateTime.parse(text.replace(' ', 'T')).atZone(ZoneOffset.UTC));
        }
        if (parsed == null) {
            parsed = tryParse(raw, text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC));
        }
        return parsed;
    }

    /** Null when the text does not parse, or parses to an instant outside the UTC date range. */
    private static ZonedDateTime tryParse(String raw, Function<String, ZonedDateTime> parser) {
        try {
            return parser.apply(raw);
        } catch (DateTimeException e) {
            return null;
        }
    }

    // --- Collection ---

    private List<JsonNode> array(List<JsonNode> args) {
        return toArr(arg(args, 0), maxArrayElements);
    }

    /** Values to aggregate: the array itself, or the named field of each element. */
    private List<JsonNode> values(List<JsonNode> args) {
        List<JsonNode> items = array(args);
        JsonNode field = arg(args, 1);
        return JsonValues.isNullish(field) ? items : pluck(items, toStr(field));
    }

    private double sum(List<JsonNode> args) {
        double total = 0;
        for (JsonNode value : values(args)) {
            total += toNum(value);
        }
        return total;
    }

    private JsonNode avg(List<JsonNode> args) {
        int size = array(args).size();
        if (size == 0) {
            return JsonValues.number(0);
        }
        return JsonValues.number(sum(args) / size);
    }

    private JsonNode extreme(List<JsonNode> args, boolean min) {
        List<JsonNode> values = values(args);
        if (values.isEmpty()) {
            return JsonValues.number(0);
        }
        double result = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (JsonNode value : values) {
            double d = toNum(value);
            result = min ? Math.min(result, d) : Math.max(result, d);
        }
        return JsonValues.number(result);
    }

    private JsonNode first(List<JsonNode> args) {
        List<JsonNode> items = array(args);
        return items.isEmpty() ? NullNode.getInstance() : items.get(0);
    }

    private JsonNode last(List<JsonNode> args) {
        List<JsonNode> items = array(args);
        return items.isEmpty() ? NullNode.getInstance() : items.get(items.size() - 1);
    }

    private JsonNode unique(List<JsonNode> args) {
        List<JsonNode> items = array(args);
        JsonNode field = arg(args, 1);
        ArrayNode out = NODES.arrayNode();
        if (!JsonValues.isNullish(field)) {
            String name = toStr(field);
            Set<String> seen = new HashSet<>();
            for (JsonNode item : items) {
                if (seen.add(toStr(Coercions.field(item, name)))) {
                    out.add(item);
                }
            }
            return out;
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (JsonNode item : items) {
            distinct.add(toStr(item));
        }
        distinct.forEach(out::add);
        return out;
    }

    private JsonNode filter(List<JsonNode> args) {
        List<JsonNode> items = array(args);
        String field = toStr(arg(args, 1));
        String op = toStr(arg(args, 2));
        JsonNode value = arg(args, 3);
        ArrayNode out = NODES.arrayNode();
        for (JsonNode item : items) {
            JsonNode v = item != null && item.isContainerNode() ? Coercions.field(item, field) : item;
            if (matches(v, op, value)) {
                out.add(item);
            }
        }
        return out;
    }

    private static boolean matches(JsonNode v, String op, JsonNode value) {
        return switch (op) {
            case "eq", "==" -> JsonValues.looseEquals(v, value);
            case "ne", "!=" -> !JsonValues.looseEquals(v, value);
            case "gt", ">" -> toNum(v) > toNum(value);
            case "gte", ">=" -> toNum(v) >= toNum(value);
            case "lt", "<" -> toNum(v) < toNum(value);
            case "lte", "<=" -> toNum(v) <= toNum(value);
            case "contains" -> toStr(v).contains(toStr(value));
            default -> false;
        };
    }

    private JsonNode map(List<JsonNode> args) {
        ArrayNode out = NODES.arrayNode();
        for (JsonNode value : pluck(array(args), toStr(arg(args, 1)))) {
            out.add(value.isMissingNode() ? NullNode.getInstance() : value);
        }
        return out;
    }

    // --- Utility ---

    private static JsonNode coalesce(List<JsonNode> args) {
        for (JsonNode value : args) {
            if (!JsonValues.isNullish(value) && !(value.isTextual() && value.asText().isEmpty())) {
                return value;
            }
        }
        return NullNode.getInstance();
    }

    // --- Helpers ---

    private static JsonNode text(String value) {
        return JsonValues.text(value);
    }

    private static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    private static int clamp(int index, int len) {
        return Math.max(0, Math.min(index, len));
    }

    private static String pad(int value) {
        return value < 10 ? "0" + value : String.valueOf(value);
    }

    private static String replaceFirst(String source, String token, String replacement) {
        int at = source.indexOf(token);
        if (at < 0) {
            return source;
        }
        return source.substring(0, at) + replacement + source.substring(at + token.length());
    }

    private static Map<String, FunctionSignature> buildSignatures() {
        Map<String, FunctionSignature> s = new LinkedHashMap<>();
        s.put("uppercase", FunctionSignature.of("string", "Convert to uppercase", "string"));
        s.put("lowercase", FunctionSignature.of("string", "Convert to lowercase", "string"));
        s.put("trim", FunctionSignature.of("string", "Trim whitespace", "string"));
        s.put("substring", FunctionSignature.of("string", "Extract substring", "string", "start", "end?"));
        s.put("includes", FunctionSignature.of("boolean", "Check if string includes", "string", "search"));
        s.put("startsWith", FunctionSignature.of("boolean", "Check prefix", "string", "prefix"));
        s.put("endsWith", FunctionSignature.of("boolean", "Check suffix", "string", "suffix"));
        s.put("replace", FunctionSignature.of(
                "string", "Replace first occurrence", "string", "search", "replacement"));
        s.put("split", FunctionSignature.of("string[]", "Split string", "string", "separator"));
        s.put("join", FunctionSignature.of("string", "Join array to string", "array", "separator"));
        s.put("length", FunctionSignature.of("number", "Length of string or array", "value"));
        s.put("round", FunctionSignature.of("number", "Round number", "number", "decimals?"));
        s.put("ceil", FunctionSignature.of("number", "Round up", "number"));
        s.put("floor", FunctionSignature.of("number", "Round down", "number"));
        s.put("abs", FunctionSignature.of("number", "Absolute value", "number"));
        s.put("now", FunctionSignature.of("string", "Current ISO timestamp"));
        s.put("formatDate", FunctionSignature.of(
                "string", "Format date (YYYY-MM-DD HH:mm:ss)", "date", "format"));
        s.put("sum", FunctionSignature.of("number", "Sum of array values", "array", "field?"));
        s.put("avg", FunctionSignature.of("number", "Average of array values", "array", "field?"));
        s.put("min", FunctionSignature.of("number", "Minimum value", "array", "field?"));
        s.put("max", FunctionSignature.of("number", "Maximum value", "array", "field?"));
        s.put("count", FunctionSignature.of("number", "Count of array elements", "array"));
        s.put("first", FunctionSignature.of("unknown", "First element", "array"));
        s.put("last", FunctionSignature.of("unknown", "Last element", "array"));
        s.put("unique", FunctionSignature.of("array", "Unique elements", "array", "field?"));
        s.put("filter", FunctionSignature.of(
                "array", "Filter array (eq,ne,gt,gte,lt,lte,contains)", "array", "field", "operator", "value"));
        s.put("map", FunctionSignature.of("array", "Extract field from array objects", "array", "field"));
        s.put("coalesce", FunctionSignature.of("unknown", "First non-null value", "...values"));
        s.put("ifElse", FunctionSignature.of(
                "unknown", "Conditional value", "condition", "trueValue", "falseValue"));
        s.put("toString", FunctionSignature.of("string", "Convert to string", "value"));
        s.put("toNumber", FunctionSignature.of("number", "Convert to number", "value"));
        s.put("formatNumber", FunctionSignature.of("string", "Format number with decimals", "number", "decimals?"));
        return Collections.unmodifiableMap(s);
    }
}
