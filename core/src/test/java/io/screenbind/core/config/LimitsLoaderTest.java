package io.screenbind.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.screenbind.core.engine.EngineLimits;
import io.screenbind.core.error.LimitsLoadException;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LimitsLoader")
class LimitsLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void shippedDefaultsMatchBuiltInDefaults() {
            assertThat(LimitsLoader.loadFromClasspath(LimitsLoader.DEFAULT_RESOURCE, NO_ENV))
                    .isEqualTo(EngineLimits.DEFAULT);
        }

        @Test
        void loadsEveryKey() {
            EngineLimits limits = LimitsLoader.loadFromClasspath("limits/strict.yaml", NO_ENV);

            assertThat(limits).isEqualTo(new EngineLimits(50, 3, 4, 6, 100));
        }

        @Test
        void missingKeysKeepDefaults() {
            EngineLimits limits = LimitsLoader.loadFromClasspath("limits/partial.yaml", NO_ENV);

            assertThat(limits).isEqualTo(EngineLimits.DEFAULT.withMaxEvalDepth(20));
        }

        @Test
        void loadsFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("limits.yaml");
            Files.writeString(file, "limits:\n  max-arguments: 8\n");

            assertThat(LimitsLoader.load(file, NO_ENV).maxArguments()).isEqualTo(8);
        }

        @Test
        void emptyDocumentYieldsDefaults() {
            assertThat(LimitsLoader.load(yaml(""), NO_ENV)).isEqualTo(EngineLimits.DEFAULT);
            assertThat(LimitsLoader.load(yaml("other: 1\n"), NO_ENV)).isEqualTo(EngineLimits.DEFAULT);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFile(@TempDir Path dir) {
            Path absent = dir.resolve("absent.yaml");

            assertThatThrownBy(() -> LimitsLoader.load(absent, NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("Limits file not found");
        }

        @Test
        void missingClasspathResource() {
            assertThatThrownBy(() -> LimitsLoader.loadFromClasspath("limits/nope.yaml", NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("not found on classpath");
        }

        @Test
        void nonIntegerValue() {
            assertThatThrownBy(() -> LimitsLoader.load(yaml("limits:\n  max-tokens: lots\n"), NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("limits.max-tokens must be an integer");
            assertThatThrownBy(() -> LimitsLoader.load(yaml("limits:\n  max-tokens: 1.5\n"), NO_ENV))
                    .isInstanceOf(LimitsLoadException.class);
        }

        @Test
        void nonPositiveValue() {
            assertThatThrownBy(() -> LimitsLoader.load(yaml("limits:\n  max-eval-depth: 0\n"), NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("maxEvalDepth must be positive");
        }

        @Test
        void limitsMustBeAMapping() {
            assertThatThrownBy(() -> LimitsLoader.load(yaml("limits: [1, 2]\n"), NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("'limits' must be a mapping");
        }

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> LimitsLoader.load(yaml("limits: [unclosed\n"), NO_ENV))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessageContaining("Failed to parse limits YAML");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        void envOverridesYaml() {
            Map<String, String> env = Map.of(
                    LimitsLoader.ENV_MAX_TOKENS, "120",
                    LimitsLoader.ENV_MAX_EVAL_DEPTH, " 12 ");

            EngineLimits limits = LimitsLoader.loadFromClasspath("limits/strict.yaml", env::get);

            assertThat(limits.maxTokens()).isEqualTo(120);
            assertThat(limits.maxEvalDepth()).isEqualTo(12);
            assertThat(limits.maxParseDepth()).isEqualTo(3);
        }

        @Test
        void blankVariablesAreIgnored() {
            Map<String, String> env = Map.of(LimitsLoader.ENV_MAX_ARGUMENTS, "  ");

            assertThat(LimitsLoader.fromEnvironment(env::get)).isEqualTo(EngineLimits.DEFAULT);
        }

        @Test
        void everyVariableIsRecognised() {
            Map<String, String> env = Map.of(
                    LimitsLoader.ENV_MAX_TOKENS, "1",
                    LimitsLoader.ENV_MAX_PARSE_DEPTH, "2",
                    LimitsLoader.ENV_MAX_ARGUMENTS, "3",
                    LimitsLoader.ENV_MAX_EVAL_DEPTH, "4",
                    LimitsLoader.ENV_MAX_ARRAY_ELEMENTS, "5");

            assertThat(LimitsLoader.fromEnvironment(env::get)).isEqualTo(new EngineLimits(1, 2, 3, 4, 5));
        }

        @Test
        void nonNumericVariableFails() {
            Map<String, String> env = Map.of(LimitsLoader.ENV_MAX_PARSE_DEPTH, "deep");

            assertThatThrownBy(() -> LimitsLoader.fromEnvironment(env::get))
                    .isInstanceOf(LimitsLoadException.class)
                    .hasMessage("SCREENBIND_MAX_PARSE_DEPTH must be an integer, got: 'deep'");
        }

        @Test
        void nullLookupMeansNoOverlay() {
            assertThat(LimitsLoader.fromEnvironment(null)).isEqualTo(EngineLimits.DEFAULT);
        }
    }
}
