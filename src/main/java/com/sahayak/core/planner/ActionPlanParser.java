package com.sahayak.core.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sahayak.core.llm.LlmParseException;
import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.Step;
import com.sahayak.core.model.StepTarget;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns raw chat-model output into a validated {@link ActionPlan}.
 * <p>
 * Parsing is permissive about wrapping (markdown fences, prose around the
 * object) and strict about content: every step must be one of the four known
 * kinds with exactly its own fields.
 */
public class ActionPlanParser {

    private static final Map<String, Set<String>> ALLOWED_FIELDS = Map.of(
            Step.NAVIGATE, Set.of("kind", "url"),
            Step.FILL, Set.of("kind", "target", "value"),
            Step.CLICK, Set.of("kind", "target"),
            Step.SPEAK, Set.of("kind", "text")
    );

    private static final Set<String> TARGET_FIELDS = Set.of("aria", "element_id");

    private final ObjectMapper objectMapper;

    public ActionPlanParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ActionPlan parse(String raw) {
        JsonNode root = readObject(extractJsonObject(raw));

        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray() || stepsNode.isEmpty()) {
            throw new LlmParseException("Plan has no steps");
        }
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < stepsNode.size(); i++) {
            steps.add(parseStep(stepsNode.get(i), i));
        }

        // The model's plan_id is not trusted: it correlates execution results to audit records.
        String planId = UUID.randomUUID().toString();

        Map<String, Object> meta = new LinkedHashMap<>();
        JsonNode metaNode = root.get("meta");
        if (metaNode != null && metaNode.isObject()) {
            meta.putAll(objectMapper.convertValue(metaNode, new TypeReference<Map<String, Object>>() {}));
        }
        meta.putIfAbsent(ActionPlan.META_SOURCE, PlanGenerator.SOURCE_LLM);

        return new ActionPlan(planId, steps, meta);
    }

    /**
     * Strips markdown fences and returns the outermost {@code {...}} span.
     */
    static String extractJsonObject(String raw) {
        if (raw == null) {
            throw new LlmParseException("LLM response is null");
        }
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmParseException("No JSON object found in LLM response");
        }
        return cleaned.substring(start, end + 1);
    }

    private JsonNode readObject(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new LlmParseException("LLM response is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Failed to parse LLM response: " + e.getOriginalMessage(), e);
        }
    }

    private Step parseStep(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw invalid(index, "step is not an object");
        }
        String kind = node.path("kind").asText("");
        Set<String> allowed = ALLOWED_FIELDS.get(kind);
        if (allowed == null) {
            throw invalid(index, "unknown kind '" + kind + "'");
        }
        rejectUnknownFields(node, allowed, index);

        return switch (kind) {
            case Step.NAVIGATE -> Step.navigate(requireText(node, "url", index));
            case Step.FILL -> Step.fill(parseTarget(node.get("target"), index), requireValue(node, index));
            case Step.CLICK -> Step.click(parseTarget(node.get("target"), index));
            case Step.SPEAK -> Step.speak(requireText(node, "text", index));
            default -> throw invalid(index, "unknown kind '" + kind + "'");
        };
    }

    private StepTarget parseTarget(JsonNode target, int index) {
        if (target == null || !target.isObject()) {
            throw invalid(index, "missing target");
        }
        rejectUnknownFields(target, TARGET_FIELDS, index);
        String aria = textOrNull(target.get("aria"));
        String elementId = textOrNull(target.get("element_id"));
        if (aria == null && elementId == null) {
            throw invalid(index, "target needs aria or element_id");
        }
        return new StepTarget(aria, elementId);
    }

    private String requireText(JsonNode node, String field, int index) {
        String value = textOrNull(node.get(field));
        if (value == null) {
            throw invalid(index, "missing " + field);
        }
        return value;
    }

    private String requireValue(JsonNode node, int index) {
        JsonNode value = node.get("value");
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw invalid(index, "missing value");
        }
        return value.asText();
    }

    private void rejectUnknownFields(JsonNode node, Set<String> allowed, int index) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                throw invalid(index, "unexpected field '" + name + "'");
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static LlmParseException invalid(int index, String reason) {
        return new LlmParseException("Invalid step " + index + ": " + reason);
    }
}
