package com.sahayak.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed payloads of the inbound frames that carry more than a context snapshot.
 */
public final class Payloads {

    private Payloads() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TextCommand(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AudioChunk(String data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AudioEnd(String language) {}

    /**
     * @param planId id of the plan the client executed
     * @param status {@code success} or anything else for a failure
     * @param error  client-side error description, may be null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExecutionResult(
        @JsonProperty("plan_id") String planId,
        String status,
        String error
    ) {
        public boolean succeeded() {
            return "success".equalsIgnoreCase(status);
        }
    }
}
