package io.screenbind.core.expr;

import static org.assertj.core.api.Assertions.assertThat;

import io.screenbind.core.model.ExprNode;
import org.junit.jupiter.api.Test;

class AstInspectorTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void collectsPathsInSourceOrderWithDuplicates() {
        ExprNode ast = parser.parse("state.a > 1 ? upper(inputs.name) : [state.a, context.user_id]");

        assertThat(AstInspector.collectPaths(ast))
                .containsExactly("state.a", "inputs.name", "state.a", "context.user_id");
    }

    @Test
    void collectsFunctionNamesIncludingNestedCalls() {
        ExprNode ast = parser.parse("round(sum(state.items, 'v') / count(state.items), 2) + -abs(state.x)");

        assertThat(AstInspector.collectFunctions(ast)).containsExactly("round", "sum", "count", "abs");
    }

    @Test
    void callNamesAreNotPaths() {
        ExprNode ast = parser.parse("now()");

        assertThat(AstInspector.collectPaths(ast)).isEmpty();
        assertThat(AstInspector.collectFunctions(ast)).containsExactly("now");
    }

    @Test
    void literalsContributeNothing() {
        ExprNode ast = parser.parse("!(1 + 'a' == null)");

        assertThat(AstInspector.collectPaths(ast)).isEmpty();
        assertThat(AstInspector.collectFunctions(ast)).isEmpty();
    }

    @Test
    void disallowedCallIsVisibleBeforeEvaluation() {
        ExprNode ast = parser.parse("ifElse(state.ok, doEval('x'), 0)");

        assertThat(AstInspector.collectFunctions(ast)).contains("doEval");
    }
}
