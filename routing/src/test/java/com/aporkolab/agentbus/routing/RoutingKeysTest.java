package com.aporkolab.agentbus.routing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RoutingKeysTest {

    @Nested
    @DisplayName("Formatting")
    class Formatting {

        @Test
        @DisplayName("should substitute named placeholders")
        void shouldSubstitutePlaceholders() {
            assertThat(RoutingKeys.format("agent.{agent_id}", Map.of("agent_id", "x1")))
                    .isEqualTo("agent.x1");
        }

        @Test
        @DisplayName("should ignore extra parameters")
        void shouldIgnoreExtraParameters() {
            String key = RoutingKeys.format("task.{agent_type}.{task_type}",
                    Map.of("agent_type", "backend", "task_type", "api", "unused", "x"));

            assertThat(key).isEqualTo("task.backend.api");
        }

        @Test
        @DisplayName("should stringify non-string values")
        void shouldStringifyValues() {
            assertThat(RoutingKeys.format("response.{agent_id}.{correlation_id}",
                    Map.of("agent_id", "a", "correlation_id", 42)))
                    .isEqualTo("response.a.42");
        }

        @Test
        @DisplayName("should return templates without placeholders unchanged")
        void shouldKeepLiteralTemplates() {
            assertThat(RoutingKeys.format("retry.default", Map.of())).isEqualTo("retry.default");
        }

        @Test
        @DisplayName("should name the missing parameter")
        void shouldNameMissingParameter() {
            assertThatThrownBy(() -> RoutingKeys.format("agent.{agent_id}", Map.of("foo", "bar")))
                    .isInstanceOf(MissingParameterException.class)
                    .hasMessageContaining("agent_id")
                    .satisfies(e -> {
                        MissingParameterException missing = (MissingParameterException) e;
                        assertThat(missing.getParameter()).isEqualTo("agent_id");
                        assertThat(missing.getTemplate()).isEqualTo("agent.{agent_id}");
                        assertThat(missing.getCode()).isEqualTo("MISSING_PARAMETER");
                    });
        }

        @Test
        @DisplayName("should treat null values as missing")
        void shouldTreatNullAsMissing() {
            Map<String, Object> params = new HashMap<>();
            params.put("agent_id", null);

            assertThatThrownBy(() -> RoutingKeys.format("agent.{agent_id}", params))
                    .isInstanceOf(MissingParameterException.class);
        }
    }

    @Nested
    @DisplayName("Structural matching")
    class StructuralMatching {

        @ParameterizedTest(name = "{0} vs {1} -> {2}")
        @CsvSource({
                "agent.{agent_id}.{message_type}, agent.backend_1.status, true",
                "task.{agent_type}.{task_type},  agent.backend_1.status, false",
                "agent.{agent_id}.{message_type}, agent.backend_1,       false",
                "system.{command},               system.shutdown,        true",
                "system.planning,                system.planning,        true",
                "system.planning,                system.shutdown,        false",
                "failed.{original_routing_key},  failed.worker_7,        true"
        })
        void shouldMatchSegmentBySegment(String pattern, String key, boolean expected) {
            assertThat(RoutingKeys.matches(pattern, key)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should list placeholders in order")
        void shouldListPlaceholders() {
            assertThat(RoutingKeys.placeholders("response.{agent_id}.{correlation_id}"))
                    .containsExactly("agent_id", "correlation_id");
        }
    }
}
