package io.screenbind.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class EngineLimitsTest {

    @Test
    void defaults() {
        assertThat(EngineLimits.DEFAULT.maxTokens()).isEqualTo(500);
        assertThat(EngineLimits.DEFAULT.maxParseDepth()).isEqualTo(10);
        assertThat(EngineLimits.DEFAULT.maxArguments()).isEqualTo(50);
        assertThat(EngineLimits.DEFAULT.maxEvalDepth()).isEqualTo(10);
        assertThat(EngineLimits.DEFAULT.maxArrayElements()).isEqualTo(10_000);
    }

    @Test
    void withersReplaceOneField() {
        EngineLimits changed = EngineLimits.DEFAULT.withMaxTokens(100).withMaxArrayElements(5);

        assertThat(changed).isEqualTo(new EngineLimits(100, 10, 50, 10, 5));
        assertThat(EngineLimits.DEFAULT.maxTokens()).isEqualTo(500);
    }

    @Test
    void rejectsNonPositiveValues() {
        assertThatThrownBy(() -> EngineLimits.DEFAULT.withMaxParseDepth(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("maxParseDepth must be positive, got: 0");
        assertThatThrownBy(() -> new EngineLimits(1, 1, 1, 1, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
