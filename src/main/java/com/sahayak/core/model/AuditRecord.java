package com.sahayak.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * Durable log entry for one dispatched command.
 *
 * @param id          record id (UUID string)
 * @param userId      owning user, null once the user is deleted
 * @param commandText the transcript or typed command
 * @param actionJson  serialized plan document
 * @param result      {@code dispatched} until the execution result arrives
 * @param error       client-reported error, if any
 * @param createdAt   creation time
 */
public record AuditRecord(
    String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("command_text") String commandText,
    @JsonProperty("action_json") @JsonRawValue String actionJson,
    String result,
    String error,
    @JsonProperty("created_at") Instant createdAt
) {

    public static final String DISPATCHED = "dispatched";
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";
    public static final String ABANDONED = "abandoned";

    public AuditRecord withResult(String newResult, String newError) {
        return new AuditRecord(id, userId, commandText, actionJson, newResult, newError, createdAt);
    }

    public boolean isDispatched() {
        return DISPATCHED.equals(result);
    }
}
