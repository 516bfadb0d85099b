package com.sahayak.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Plan produced for one user command: an ordered list of UI steps the client
 * executes, plus metadata describing where the plan came from.
 * <p>
 * A plan always carries at least one step. The {@code plan_id} is echoed back by
 * the client in its execution result so the audit record can be updated.
 *
 * @param planId unique id for this command
 * @param steps  ordered, non-empty list of steps
 * @param meta   confidence score, source tag ({@code llm} or {@code fallback}) and language
 */
public record ActionPlan(
    @JsonProperty("plan_id") String planId,
    List<Step> steps,
    Map<String, Object> meta
) implements Serializable {

    public static final String META_CONFIDENCE = "confidence";
    public static final String META_SOURCE = "source";
    public static final String META_LANGUAGE = "language";

    public ActionPlan {
        Objects.requireNonNull(planId, "planId must not be null");
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("an action plan needs at least one step");
        }
        steps = List.copyOf(steps);
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    /**
     * Text of the first {@code speak} step, spoken to the user before the plan is dispatched.
     */
    @JsonIgnore
    public Optional<String> acknowledgement() {
        return steps.stream()
                .filter(Step.Speak.class::isInstance)
                .map(step -> ((Step.Speak) step).text())
                .findFirst();
    }

    @JsonIgnore
    public String source() {
        Object source = meta.get(META_SOURCE);
        return source != null ? source.toString() : "unknown";
    }
}
