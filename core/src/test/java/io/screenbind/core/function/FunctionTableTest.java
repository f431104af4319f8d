package io.screenbind.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class FunctionTableTest {

    private static final SafeFunction HELLO = args -> TextNode.valueOf("hello");
    private static final SafeFunction BYE = args -> TextNode.valueOf("bye");

    @Test
    void lookupReturnsRegisteredFunctionOnly() {
        FunctionTable table = FunctionTable.builder().register("greet", HELLO).build();

        assertThat(table.lookup("greet")).containsSame(HELLO);
        assertThat(table.lookup("Greet")).isEmpty();
        assertThat(table.lookup("toString")).isEmpty();
    }

    @Test
    void lastRegistrationWins() {
        FunctionTable table =
                FunctionTable.builder().register("greet", HELLO).register("greet", BYE).build();

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.lookup("greet").orElseThrow().apply(List.of()).asText()).isEqualTo("bye");
    }

    @Test
    void namesKeepRegistrationOrder() {
        FunctionTable table = FunctionTable.builder()
                .register("b", HELLO)
                .register("a", HELLO)
                .register("c", HELLO)
                .build();

        assertThat(table.names()).containsExactly("b", "a", "c");
    }

    @Test
    void tableIsImmutable() {
        FunctionTable table = FunctionTable.builder().register("greet", HELLO).build();

        assertThatThrownBy(() -> table.names().add("other")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toBuilderExtendsWithoutTouchingOriginal() {
        FunctionTable base = SafeFunctions.table();
        FunctionTable extended = base.toBuilder().register("greet", HELLO).build();

        assertThat(extended.size()).isEqualTo(base.size() + 1);
        assertThat(base.contains("greet")).isFalse();
        assertThat(extended.contains("uppercase")).isTrue();
    }

    @Test
    void rejectsInvalidRegistrations() {
        FunctionTable.Builder builder = FunctionTable.builder();

        assertThatThrownBy(() -> builder.register(null, HELLO)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> builder.register("", HELLO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.register("x", null)).isInstanceOf(NullPointerException.class);
    }
}
