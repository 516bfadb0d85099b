package com.sahayak.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Reference to an interactive element on the client page.
 *
 * @param aria      the element's ARIA label or anchor id
 * @param elementId the DOM id, used when no ARIA anchor exists
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepTarget(
    String aria,
    @JsonProperty("element_id") String elementId
) implements Serializable {

    public StepTarget {
        if (isBlank(aria) && isBlank(elementId)) {
            throw new IllegalArgumentException("target needs an aria label or an element_id");
        }
    }

    public static StepTarget aria(String aria) {
        return new StepTarget(aria, null);
    }

    public static StepTarget elementId(String elementId) {
        return new StepTarget(null, elementId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
