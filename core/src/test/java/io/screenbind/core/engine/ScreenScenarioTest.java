package io.screenbind.core.engine;

import static io.screenbind.core.testkit.TestJson.json;
import static io.screenbind.core.testkit.TestJson.obj;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.screenbind.core.model.BindingContext;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * End-to-end render passes over a small dashboard screen: bindings applied on load, an action
 * dispatched and its result merged, then the screen rendered again.
 */
@DisplayName("Screen scenarios")
class ScreenScenarioTest {

    private final BindingEngine engine = new BindingEngine();

    private final BindingContext ctx = BindingContext.builder()
            .state(obj("{'x': 5, 'items': [{'value': 10}, {'value': 20}], 'user': {'first': 'Ada', 'last': 'Lovelace'}}"))
            .inputs(obj("{'site': 'north'}"))
            .context(obj("{'user_id': 'u-1'}"))
            .traceId("t-77")
            .build();

    static Stream<Arguments> renderCases() {
        return Stream.of(
                Arguments.of("{{state.x}}", "5"),
                Arguments.of("v={{state.x}}", "\"v=5\""),
                Arguments.of("{{ sum(state.items, 'value') > 25 ? 'high' : 'low' }}", "\"high\""),
                Arguments.of("{{ 1 / 0 }}", "0"),
                Arguments.of("{{user.name}}", "null"),
                Arguments.of("name: {{user.name}}", "\"name: \""),
                Arguments.of("{{ state.user.first + ' ' + state.user.last }}", "\"Ada Lovelace\""),
                Arguments.of("{{ formatNumber(avg(state.items, 'value'), 1) }}", "\"15.0\""),
                Arguments.of("{{ coalesce(state.nickname, state.user.first) }}", "\"Ada\""),
                Arguments.of("{{ ifElse(true, [state.x, inputs.site, state.none], 0) }}", "[5, \"north\", null]"),
                Arguments.of("{{ state.x >= 5 && context.user_id }}", "\"u-1\""),
                Arguments.of("{{ doEval(1) }}", "null"));
    }

    @ParameterizedTest(name = "{0} → {1}")
    @MethodSource("renderCases")
    void rendersBinding(String template, String expectedJson) {
        assertThat(engine.render(TextNode.valueOf(template), ctx)).isEqualTo(json(expectedJson));
    }

    @Test
    void loadDispatchAndRerender() {
        ObjectNode state = obj("{}");
        BindingContext live = BindingContext.builder()
                .state(state)
                .inputs(obj("{'device_id': 'dev-9'}"))
                .traceId("t-1")
                .build();
        JsonNode screen = json("{'title': 'Device {{state.device}}',"
                + " 'spinner': '{{ state.__loading.refresh || false }}',"
                + " 'rows': '{{ count(state.results.refresh.rows) }}',"
                + " 'status': '{{state.status}}'}");

        BindingMutators.applyBindings(state, Map.of("state.device", "{{inputs.device_id}}"), live);
        BindingMutators.setLoading(state, "refresh", true);
        assertThat(engine.render(screen, live))
                .isEqualTo(json("{'title': 'Device dev-9', 'spinner': true, 'rows': 0, 'status': null}"));

        BindingMutators.applyActionResultToState(
                state, "refresh", json("{'rows': [1, 2, 3], 'state_patch': {'status': 'ok'}}"));
        BindingMutators.setLoading(state, "refresh", false);
        assertThat(engine.render(screen, live))
                .isEqualTo(json("{'title': 'Device dev-9', 'spinner': false, 'rows': 3, 'status': 'ok'}"));
    }

    @Test
    void renderingIsDeterministic() {
        JsonNode screen = json("{'a': '{{ round(state.x * 1.15, 2) }}', 'b': 'x{{state.items}}'}");

        assertThat(engine.render(screen, ctx)).isEqualTo(engine.render(screen, ctx));
    }
}
