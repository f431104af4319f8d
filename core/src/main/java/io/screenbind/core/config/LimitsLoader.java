package io.screenbind.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.error.LimitsLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineLimits} from YAML with an optional environment variable overlay.
 *
 * <p>
 * Expected shape; every key is optional and missing keys keep the defaults from
 * {@link EngineLimits#DEFAULT}:
 *
 * <pre>
 * limits:
 *   max-tokens: 500
 *   max-parse-depth: 10
 *   max-arguments: 50
 *   max-eval-depth: 10
 *   max-array-elements: 10000
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only if it is
 * defined and non-blank after trimming.
 */
public final class LimitsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LimitsLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath resource holding the shipped defaults. */
    public static final String DEFAULT_RESOURCE = "screen-binding.yaml";

    public static final String ENV_MAX_TOKENS = "SCREENBIND_MAX_TOKENS";
    public static final String ENV_MAX_PARSE_DEPTH = "SCREENBIND_MAX_PARSE_DEPTH";
    public static final String ENV_MAX_ARGUMENTS = "SCREENBIND_MAX_ARGUMENTS";
    public static final String ENV_MAX_EVAL_DEPTH = "SCREENBIND_MAX_EVAL_DEPTH";
    public static final String ENV_MAX_ARRAY_ELEMENTS = "SCREENBIND_MAX_ARRAY_ELEMENTS";

    private LimitsLoader() {
        // utility class
    }

    /**
     * Loads limits from a YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws LimitsLoadException if the file is missing, is not valid YAML, or holds an invalid
     *                             value
     */
    public static EngineLimits load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads limits from a YAML file with the supplied environment lookup. Returning {@code null}
     * from {@code envLookup} means the variable is not defined.
     */
    public static EngineLimits load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new LimitsLoadException("Limits file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            EngineLimits limits = load(in, envLookup);
            LOG.info("Loaded engine limits from {}: {}", configPath, limits);
            return limits;
        } catch (IOException e) {
            throw new LimitsLoadException("Failed to read limits file: " + configPath, e);
        }
    }

    /** Loads limits from a YAML stream; the caller closes the stream. */
    public static EngineLimits load(InputStream yaml, Function<String, String> envLookup) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new LimitsLoadException("Failed to parse limits YAML", e);
        }
        // An empty document parses to null or MissingNode.
        JsonNode limits = root == null ? null : root.path("limits");
        return build(limits, envLookup);
    }

    /** Loads limits from a classpath resource with the supplied environment lookup. */
    public static EngineLimits loadFromClasspath(String resource, Function<String, String> envLookup) {
        InputStream in = LimitsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new LimitsLoadException("Limits resource not found on classpath: " + resource);
        }
        try (in) {
            EngineLimits limits = load(in, envLookup);
            LOG.info("Loaded engine limits from classpath:{}: {}", resource, limits);
            return limits;
        } catch (IOException e) {
            throw new LimitsLoadException("Failed to read limits resource: " + resource, e);
        }
    }

    /** Defaults with only the environment overlay applied. */
    public static EngineLimits fromEnvironment(Function<String, String> envLookup) {
        return build(null, envLookup);
    }

    private static EngineLimits build(JsonNode limits, Function<String, String> envLookup) {
        JsonNode section = limits != null ? limits : MissingNode.getInstance();
        if (!section.isMissingNode() && !section.isNull() && !section.isObject()) {
            throw new LimitsLoadException("'limits' must be a mapping, got: " + section.getNodeType());
        }
        int maxTokens = intValue(section, "max-tokens", EngineLimits.DEFAULT_MAX_TOKENS);
        int maxParseDepth = intValue(section, "max-parse-depth", EngineLimits.DEFAULT_MAX_PARSE_DEPTH);
        int maxArguments = intValue(section, "max-arguments", EngineLimits.DEFAULT_MAX_ARGUMENTS);
        int maxEvalDepth = intValue(section, "max-eval-depth", EngineLimits.DEFAULT_MAX_EVAL_DEPTH);
        int maxArrayElements = intValue(section, "max-array-elements", EngineLimits.DEFAULT_MAX_ARRAY_ELEMENTS);

        // --- Environment variable overlay ---
        maxTokens = envInt(envLookup, ENV_MAX_TOKENS, maxTokens);
        maxParseDepth = envInt(envLookup, ENV_MAX_PARSE_DEPTH, maxParseDepth);
        maxArguments = envInt(envLookup, ENV_MAX_ARGUMENTS, maxArguments);
        maxEvalDepth = envInt(envLookup, ENV_MAX_EVAL_DEPTH, maxEvalDepth);
        maxArrayElements = envInt(envLookup, ENV_MAX_ARRAY_ELEMENTS, maxArrayElements);

        try {
            return new EngineLimits(maxTokens, maxParseDepth, maxArguments, maxEvalDepth, maxArrayElements);
        } catch (IllegalArgumentException e) {
            throw new LimitsLoadException("Invalid engine limits: " + e.getMessage(), e);
        }
    }

    private static int intValue(JsonNode section, String key, int defaultValue) {
        JsonNode value = section.path(key);
        if (value.isMissingNode() || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new LimitsLoadException("limits." + key + " must be an integer, got: " + value);
        }
        return value.intValue();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        if (envLookup == null) {
            return false;
        }
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static int envInt(Function<String, String> envLookup, String envVar, int current) {
        if (!isSet(envLookup, envVar)) {
            return current;
        }
        String raw = envLookup.apply(envVar).trim();
        try {
            int value = Integer.parseInt(raw);
            LOG.debug("Env override {}={}", envVar, value);
            return value;
        } catch (NumberFormatException e) {
            throw new LimitsLoadException(envVar + " must be an integer, got: '" + raw + "'", e);
        }
    }
}
