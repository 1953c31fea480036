package com.voucherpay.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private JsonNode json;

    @BeforeEach
    void serialize() throws Exception {
        String text = EventSerializer.serialize(SampleEvents.successfulJobsSearch());
        json = EventSerializer.mapper().readTree(text);
    }

    @Test
    @DisplayName("uses snake_case field names at the top level")
    void snakeCaseTopLevel() {
        assertThat(json.get("event_type").asText()).isEqualTo("api_request");
        assertThat(json.get("user_id").asText()).isEqualTo("u1");
        assertThat(json.get("session_id").asText()).isEqualTo("session-1");
        assertThat(json.get("correlation_id").asText()).isEqualTo("corr-1");
        assertThat(json.get("features_accessed").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("writes instants as ISO 8601 strings")
    void isoInstants() {
        assertThat(json.get("occurred_at").asText()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(json.at("/request/timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");
    }

    @Nested
    @DisplayName("nested parts")
    class NestedParts {

        @Test
        @DisplayName("request carries method, path, query and client details")
        void request() {
            assertThat(json.at("/request/method").asText()).isEqualTo("GET");
            assertThat(json.at("/request/path").asText()).isEqualTo("/api/v1/jobs/search");
            assertThat(json.at("/request/query_params/q").asText()).isEqualTo("remote");
            assertThat(json.at("/request/user_agent").asText()).isEqualTo("JAWS/2024");
            assertThat(json.at("/request/ip_address").asText()).isEqualTo("10.0.0.7");
        }

        @Test
        @DisplayName("response carries status, success and process time in seconds")
        void response() {
            assertThat(json.at("/response/status_code").asInt()).isEqualTo(200);
            assertThat(json.at("/response/success").asBoolean()).isTrue();
            assertThat(json.at("/response/process_time").asDouble()).isEqualTo(0.125);
        }

        @Test
        @DisplayName("accessibility carries every flag and the usage score")
        void accessibility() {
            assertThat(json.at("/accessibility/screen_reader").asBoolean()).isTrue();
            assertThat(json.at("/accessibility/high_contrast").asBoolean()).isFalse();
            assertThat(json.at("/accessibility/keyboard_navigation").asBoolean()).isTrue();
            assertThat(json.at("/accessibility/accessibility_score").asDouble()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("empowerment lists every feature area")
        void empowerment() {
            JsonNode empowerment = json.get("empowerment");
            assertThat(empowerment.size()).isEqualTo(FeatureArea.values().length);
            assertThat(empowerment.get("jobs").asBoolean()).isTrue();
            assertThat(empowerment.get("housing").asBoolean()).isFalse();
            assertThat(empowerment.get("ai_assistance").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("impact carries the three indicators")
        void impact() {
            assertThat(json.at("/impact/barrier_reduced").asBoolean()).isTrue();
            assertThat(json.at("/impact/opportunity_accessed").asBoolean()).isTrue();
            assertThat(json.at("/impact/support_provided").asBoolean()).isFalse();
        }
    }

    @Test
    @DisplayName("toTree matches the serialized document and can be extended")
    void treeMatchesText() {
        var event = SampleEvents.successfulJobsSearch();
        var tree = EventSerializer.toTree(event);

        assertThat(tree.get("event_id").asText()).isEqualTo(event.eventId());
        assertThat(tree.at("/response/process_time").asDouble()).isEqualTo(0.125);
        assertThat(tree.get("features_accessed").asInt()).isEqualTo(1);
        tree.put("sink", "test");
        assertThat(tree.get("sink").asText()).isEqualTo("test");
    }
}
