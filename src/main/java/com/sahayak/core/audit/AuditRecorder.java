package com.sahayak.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sahayak.core.model.ActionPlan;
import com.sahayak.core.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes one audit record per dispatched command and resolves it when the
 * client reports the execution result.
 */
@Service
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditStore store;
    private final PendingAuditIndex pendingIndex;
    private final AuditProperties properties;
    private final ObjectMapper objectMapper;

    public AuditRecorder(AuditStore store, PendingAuditIndex pendingIndex, AuditProperties properties) {
        this.store = store;
        this.pendingIndex = pendingIndex;
        this.properties = properties;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Persists a {@code dispatched} record for the plan and registers it for correlation.
     *
     * @param metadata extra context stored with the plan, e.g. the UI context at dispatch time
     * @return the audit record id
     * @throws AuditException when the record cannot be written
     */
    public String logCommand(String userId, String commandText, ActionPlan plan, Map<String, Object> metadata) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("plan_id", plan.planId());
        document.put("steps", plan.steps());
        document.put("meta", plan.meta());
        document.put("context", metadata != null ? metadata : Map.of());

        String actionJson;
        try {
            actionJson = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new AuditException("Failed to serialize plan " + plan.planId(), e);
        }

        String auditId = store.append(new AuditRecord(null, userId, commandText, actionJson,
                AuditRecord.DISPATCHED, null, null));
        try {
            pendingIndex.put(plan.planId(), auditId, userId);
        } catch (IllegalStateException e) {
            throw new AuditException(e.getMessage(), e);
        }
        log.debug("Logged command for plan {} as audit {}", plan.planId(), auditId);
        return auditId;
    }

    /**
     * Pops the pending correlation for a plan the user was sent.
     */
    public Optional<String> resolve(String planId, String userId) {
        return pendingIndex.take(planId, userId).map(PendingAuditIndex.PendingAudit::auditId);
    }

    /**
     * Best-effort result patch. Failures are logged, never thrown.
     */
    public boolean updateResult(String auditId, String result, String error) {
        try {
            return store.update(auditId, result, error);
        } catch (RuntimeException e) {
            log.warn("Failed to update audit record {} to '{}': {}", auditId, result, e.getMessage());
            return false;
        }
    }

    /**
     * Marks the user's pending commands older than the grace period as abandoned.
     *
     * @return number of entries swept
     */
    public int abandonPending(String userId) {
        var cutoff = pendingIndex.now().minus(Duration.ofSeconds(properties.getPendingGraceSeconds()));
        return abandon(pendingIndex.removeForUser(userId, cutoff));
    }

    int abandon(List<PendingAuditIndex.PendingAudit> entries) {
        for (var entry : entries) {
            updateResult(entry.auditId(), AuditRecord.ABANDONED, "client disconnected before reporting a result");
        }
        if (!entries.isEmpty()) {
            log.info("Abandoned {} pending audit record(s)", entries.size());
        }
        return entries.size();
    }

    public List<AuditRecord> recent(int limit) {
        return store.findRecent(limit);
    }
}
