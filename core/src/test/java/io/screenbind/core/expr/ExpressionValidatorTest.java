package io.screenbind.core.expr;

import static io.screenbind.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

import io.screenbind.core.model.ValidationIssue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionValidator")
class ExpressionValidatorTest {

    private final ExpressionValidator validator = new ExpressionValidator();

    private static List<String> types(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::type).toList();
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "state.count > 0 ? 'yes' : 'no'",
                    "{{ uppercase(inputs.name) }}",
                    "sum(state.items, 'value') + 1",
                    "trace_id",
                    "formatDate(now(), 'YYYY-MM-DD')"
                })
        void cleanExpressionsHaveNoIssues(String expression) {
            assertThat(validator.validate(expression)).isEmpty();
        }

        @Test
        void syntaxErrorIsReportedNotThrown() {
            List<ValidationIssue> issues = validator.validate("state.a +");

            assertThat(types(issues)).containsExactly("syntax");
            assertThat(issues.get(0).isError()).isTrue();
            assertThat(issues.get(0).message()).contains("Unexpected token");
        }

        @Test
        void complexityErrorIsReportedAsSyntax() {
            String deep = "(".repeat(11) + "1" + ")".repeat(11);

            assertThat(types(validator.validate(deep))).containsExactly("syntax");
        }

        @Test
        void unknownFunctionsAreListedOnce() {
            List<ValidationIssue> issues = validator.validate("doEval(state.a) + doEval(state.b) + fetch('x')");

            assertThat(issues)
                    .extracting(ValidationIssue::message)
                    .containsExactly("Unknown function: 'doEval'", "Unknown function: 'fetch'");
        }

        @Test
        void foreignRootIsInvalidSource() {
            List<ValidationIssue> issues = validator.validate("window.location + state.a");

            assertThat(types(issues)).containsExactly("invalid-source");
            assertThat(issues.get(0).message()).contains("'window'");
        }

        @Test
        void bareNamespaceNeedsAPath() {
            assertThat(types(validator.validate("state ? 1 : 0"))).containsExactly("missing-path");
        }

        @Test
        void emptyExpression() {
            assertThat(types(validator.validate("{{ }}"))).containsExactly("empty-expression");
            assertThat(types(validator.validate(null))).containsExactly("empty-expression");
        }

        @Test
        void customAllowList() {
            ExpressionValidator narrow = new ExpressionValidator(Set.of("uppercase"), new ExpressionParser());

            assertThat(narrow.validate("uppercase(state.a)")).isEmpty();
            assertThat(types(narrow.validate("lowercase(state.a)"))).containsExactly("unknown-function");
        }
    }

    @Nested
    @DisplayName("Paths and context keys")
    class PathChecks {

        @Test
        void knownContextKeyIsClean() {
            assertThat(validator.validatePath("{{context.user_id}}")).isEmpty();
        }

        @Test
        void uncommonContextKeyIsWarning() {
            List<ValidationIssue> issues = validator.validatePath("context.favourite_colour");

            assertThat(issues).hasSize(1);
            assertThat(issues.get(0).severity()).isEqualTo(ValidationIssue.Severity.WARNING);
            assertThat(issues.get(0).type()).isEqualTo("uncommon-context");
        }

        @Test
        void bracketIndexedPathIsClean() {
            assertThat(validator.validatePath("state.rows[0].name")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Templates and bindings maps")
    class Aggregates {

        @Test
        void validatesEveryBindingInTemplate() {
            List<ValidationIssue> issues = validator.validateTemplate(json("{'title': '{{state.title}}',"
                    + " 'rows': ['{{ doEval(1) }}', 'Hello {{user.name}}'],"
                    + " 'visible': '{{ state.count > 0 }}'}"));

            assertThat(types(issues)).containsExactly("unknown-function", "invalid-source");
        }

        @Test
        void bindingsMapReportsCyclesAndBadSources() {
            Map<String, String> bindings = new LinkedHashMap<>();
            bindings.put("state.a", "{{state.b}}");
            bindings.put("state.b", "{{state.a}}");
            bindings.put("state.c", "{{session.token}}");
            bindings.put(" ", "{{inputs.x}}");

            List<ValidationIssue> issues = validator.validateBindings(bindings);

            assertThat(types(issues)).containsExactly("circular-dependency", "invalid-source", "empty-target");
            assertThat(issues.get(0).message()).contains("a → b → a");
        }

        @Test
        void nullOrEmptyBindingsAreClean() {
            assertThat(validator.validateBindings(null)).isEmpty();
            assertThat(validator.validateBindings(Map.of())).isEmpty();
        }
    }
}
