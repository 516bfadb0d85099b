package com.sahayak.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionPlanTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects a plan without steps")
        void rejectsEmptySteps() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ActionPlan("p1", List.of(), Map.of()));
            assertThrows(IllegalArgumentException.class,
                    () -> new ActionPlan("p1", null, Map.of()));
        }

        @Test
        @DisplayName("steps are copied and immutable")
        void stepsAreCopied() {
            var steps = new ArrayList<Step>(List.of(Step.speak("Hello")));
            var plan = new ActionPlan("p1", steps, null);
            steps.add(Step.navigate("/bills"));

            assertEquals(1, plan.steps().size());
            assertThrows(UnsupportedOperationException.class, () -> plan.steps().add(Step.speak("x")));
            assertTrue(plan.meta().isEmpty());
        }

        @Test
        @DisplayName("speak step rejects blank text")
        void speakRejectsBlank() {
            assertThrows(IllegalArgumentException.class, () -> Step.speak("  "));
        }

        @Test
        @DisplayName("target needs aria or element id")
        void targetNeedsAnchor() {
            assertThrows(IllegalArgumentException.class, () -> new StepTarget(null, " "));
            assertEquals("amount", StepTarget.aria("amount").aria());
        }
    }

    @Test
    @DisplayName("acknowledgement is the first speak step")
    void acknowledgementIsFirstSpeak() {
        var plan = new ActionPlan("p1", List.of(
                Step.navigate("/transfers"),
                Step.speak("Opening transfers."),
                Step.speak("Second")), Map.of(ActionPlan.META_SOURCE, "llm"));

        assertEquals("Opening transfers.", plan.acknowledgement().orElseThrow());
        assertEquals("llm", plan.source());
    }

    @Test
    @DisplayName("plan without speak step has no acknowledgement")
    void noAcknowledgement() {
        var plan = new ActionPlan("p1", List.of(Step.click(StepTarget.elementId("submit"))), Map.of());
        assertTrue(plan.acknowledgement().isEmpty());
        assertEquals("unknown", plan.source());
    }

    @Test
    @DisplayName("serializes steps with kind discriminator and snake_case fields")
    void serializesWireFormat() throws Exception {
        var plan = new ActionPlan("p1", List.of(
                Step.navigate("/transfers"),
                Step.fill(StepTarget.aria("amount"), "500"),
                Step.click(StepTarget.elementId("submit-btn")),
                Step.speak("Sending 500 rupees.")), Map.of("confidence", 0.9));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(plan));

        assertEquals("p1", json.get("plan_id").asText());
        assertEquals("navigate", json.at("/steps/0/kind").asText());
        assertEquals("/transfers", json.at("/steps/0/url").asText());
        assertEquals("fill", json.at("/steps/1/kind").asText());
        assertEquals("amount", json.at("/steps/1/target/aria").asText());
        assertFalse(json.at("/steps/1/target").has("element_id"));
        assertEquals("500", json.at("/steps/1/value").asText());
        assertEquals("submit-btn", json.at("/steps/2/target/element_id").asText());
        assertEquals("speak", json.at("/steps/3/kind").asText());
        assertFalse(json.has("acknowledgement"));
        assertEquals(0.9, json.at("/meta/confidence").asDouble());
    }

    @Test
    @DisplayName("user context defaults missing fields")
    void userContextDefaults() throws Exception {
        UserContext context = mapper.readValue("{\"url\":\"/bills\",\"extra\":1}", UserContext.class);

        assertEquals("/bills", context.url());
        assertTrue(context.ariaIds().isEmpty());
        assertEquals("en", context.locale());
        assertNull(context.timestamp());
        assertEquals("/", UserContext.empty().url());
    }

    @Test
    @DisplayName("user context drops null and blank aria ids")
    void userContextDropsNullAriaIds() throws Exception {
        UserContext context = mapper.readValue("{\"aria_ids\":[\"btn\",null,\"\",\"btn\",\"pay\"]}", UserContext.class);

        assertEquals(List.of("btn", "pay"), List.copyOf(context.ariaIds()));
    }
}
