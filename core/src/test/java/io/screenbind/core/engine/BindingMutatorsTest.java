package io.screenbind.core.engine;

import static io.screenbind.core.testkit.TestJson.json;
import static io.screenbind.core.testkit.TestJson.obj;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.screenbind.core.model.BindingContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BindingMutators")
class BindingMutatorsTest {

    @Nested
    @DisplayName("applyBindings")
    class ApplyBindings {

        @Test
        void copiesSourcesIntoStateTargets() {
            ObjectNode state = obj("{}");
            BindingContext ctx = BindingContext.builder()
                    .state(state)
                    .inputs(obj("{'device_id': 'dev-1', 'filters': {'site': 'north'}}"))
                    .context(obj("{'user_id': 'u-7'}"))
                    .build();
            Map<String, String> bindings = new LinkedHashMap<>();
            bindings.put("state.device", "{{inputs.device_id}}");
            bindings.put("owner", "context.user_id");
            bindings.put("query.site", "{{ inputs.filters.site }}");

            BindingMutators.applyBindings(state, bindings, ctx);

            assertThat(state).isEqualTo(json("{'device': 'dev-1', 'owner': 'u-7', 'query': {'site': 'north'}}"));
        }

        @Test
        void unresolvableSourceWritesNull() {
            ObjectNode state = obj("{'keep': 1}");

            BindingMutators.applyBindings(state, Map.of("x", "{{inputs.absent}}"), BindingContext.of(state));

            assertThat(state).isEqualTo(json("{'keep': 1, 'x': null}"));
        }

        @Test
        void expressionsAreNotEvaluated() {
            ObjectNode state = obj("{'a': 2}");

            BindingMutators.applyBindings(state, Map.of("b", "{{state.a + 1}}"), BindingContext.of(state));

            assertThat(state.get("b")).isEqualTo(NullNode.getInstance());
        }

        @Test
        void nullContextReadsFromStateItself() {
            ObjectNode state = obj("{'src': {'v': 3}}");

            BindingMutators.applyBindings(state, Map.of("dst", "state.src"), null);
            ((ObjectNode) state.get("src")).put("v", 4);

            assertThat(state.get("dst")).isEqualTo(json("{'v': 3}"));
        }

        @Test
        void numericTargetSegmentsCreateArrays() {
            ObjectNode state = obj("{}");
            BindingContext ctx = BindingContext.builder().state(state).inputs(obj("{'x': 'y'}")).build();

            BindingMutators.applyBindings(state, Map.of("rows.1.name", "inputs.x"), ctx);

            assertThat(state).isEqualTo(json("{'rows': [null, {'name': 'y'}]}"));
        }

        @Test
        void blankTargetsAndEmptyMapsAreIgnored() {
            ObjectNode state = obj("{'a': 1}");

            BindingMutators.applyBindings(state, Map.of(" ", "inputs.x"), BindingContext.of(state));
            BindingMutators.applyBindings(state, Map.of(), BindingContext.of(state));
            BindingMutators.applyBindings(state, null, BindingContext.of(state));

            assertThat(state).isEqualTo(json("{'a': 1}"));
        }

        @Test
        void targetsBeyondConfiguredArrayCapAreSkipped() {
            ObjectNode state = obj("{'a': 1}");
            BindingContext ctx = BindingContext.builder().state(state).inputs(obj("{'x': 'y'}")).build();
            Map<String, String> bindings = new LinkedHashMap<>();
            bindings.put("rows.5", "inputs.x");
            bindings.put("rows.1", "inputs.x");

            BindingMutators.applyBindings(state, bindings, ctx, EngineLimits.DEFAULT.withMaxArrayElements(4));

            assertThat(state).isEqualTo(json("{'a': 1, 'rows': [null, 'y']}"));
        }
    }

    @Nested
    @DisplayName("Action results")
    class ActionResults {

        @Test
        void storesResultUnderActionId() {
            ObjectNode state = obj("{}");

            BindingMutators.applyActionResultToState(state, "load", json("{'rows': [1, 2]}"));

            assertThat(state.at("/results/load/rows/1").intValue()).isEqualTo(2);
        }

        @Test
        void mergesStatePatchKeysIntoState() {
            ObjectNode state = obj("{'title': 'old', 'filters': {'site': 'north', 'limit': 5}}");

            BindingMutators.applyActionResultToState(
                    state, "save", json("{'ok': true, 'state_patch': {'title': 'new', 'filters.limit': 10}}"));

            assertThat(state.get("title").asText()).isEqualTo("new");
            assertThat(state.get("filters")).isEqualTo(json("{'site': 'north', 'limit': 10}"));
            assertThat(state.at("/results/save/ok").booleanValue()).isTrue();
        }

        @Test
        void nonObjectPatchIsIgnored() {
            ObjectNode state = obj("{'a': 1}");

            BindingMutators.applyActionResultToState(state, "x", json("{'state_patch': [1, 2]}"));
            BindingMutators.applyActionResultToState(state, "y", json("'plain'"));

            assertThat(state.get("a").intValue()).isEqualTo(1);
            assertThat(state.at("/results/y").asText()).isEqualTo("plain");
        }

        @Test
        void undefinedResultIsStoredAsNull() {
            ObjectNode state = obj("{}");

            BindingMutators.applyActionResultToState(state, "x", MissingNode.getInstance());

            assertThat(state.get("results")).isEqualTo(json("{'x': null}"));
        }

        @Test
        void nonObjectResultsMapIsReplaced() {
            ObjectNode state = obj("{'results': 'corrupt'}");

            BindingMutators.applyActionResultToState(state, "x", json("1"));

            assertThat(state.get("results")).isEqualTo(json("{'x': 1}"));
        }

        @Test
        void overCapPatchKeyLeavesStateUntouched() {
            ObjectNode state = obj("{'title': 'old'}");

            BindingMutators.applyActionResultToState(
                    state, "save", json("{'state_patch': {'rows.10000': 'x', 'title': 'new'}}"));

            assertThat(state.has("rows")).isFalse();
            assertThat(state.get("title").asText()).isEqualTo("new");
        }

        @Test
        void requiresStateAndActionId() {
            assertThatThrownBy(() -> BindingMutators.applyActionResultToState(null, "x", json("1")))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> BindingMutators.setLoading(obj("{}"), null, true))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Loading and error flags")
    class Flags {

        @Test
        void loadingRoundTrip() {
            ObjectNode state = obj("{}");

            BindingMutators.setLoading(state, "load", true);
            assertThat(BindingMutators.isLoading(state, "load")).isTrue();
            assertThat(BindingMutators.isLoading(state, "other")).isFalse();

            BindingMutators.setLoading(state, "load", false);
            assertThat(BindingMutators.isLoading(state, "load")).isFalse();
            assertThat(state.get("__loading")).isEqualTo(json("{'load': false}"));
        }

        @Test
        void errorSetAndClear() {
            ObjectNode state = obj("{}");

            BindingMutators.setError(state, "save", "Timeout");
            assertThat(BindingMutators.errorOf(state, "save")).contains("Timeout");

            BindingMutators.setError(state, "save", null);
            assertThat(BindingMutators.errorOf(state, "save")).isEmpty();
            assertThat(state.get("__error")).isEqualTo(json("{'save': null}"));
        }

        @Test
        void flagsAreVisibleToBindings() {
            ObjectNode state = obj("{}");
            BindingMutators.setLoading(state, "load", true);

            assertThat(new TemplateRenderer().renderString("{{state.__loading.load}}", BindingContext.of(state))
                            .booleanValue())
                    .isTrue();
        }

        @Test
        void readersTolerateNullState() {
            assertThat(BindingMutators.isLoading(null, "x")).isFalse();
            assertThat(BindingMutators.errorOf(null, "x")).isEmpty();
        }
    }
}
