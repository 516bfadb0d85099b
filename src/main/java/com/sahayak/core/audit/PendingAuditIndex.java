package com.sahayak.core.audit;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-process correlation of dispatched plan ids to their audit records.
 * Not durable: a restart between dispatch and result loses the entry.
 */
@Component
public class PendingAuditIndex {

    public record PendingAudit(String auditId, String userId, Instant createdAt) {}

    private final Map<String, PendingAudit> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public PendingAuditIndex() {
        this(Clock.systemUTC());
    }

    PendingAuditIndex(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a dispatched plan. An id that is already pending is never overwritten.
     *
     * @throws IllegalStateException when {@code planId} is already pending
     */
    public void put(String planId, String auditId, String userId) {
        PendingAudit existing = pending.putIfAbsent(planId, new PendingAudit(auditId, userId, clock.instant()));
        if (existing != null) {
            throw new IllegalStateException("Plan " + planId + " is already pending as audit " + existing.auditId());
        }
    }

    /**
     * Removes and returns the entry for {@code planId} if it belongs to {@code userId}.
     */
    public Optional<PendingAudit> take(String planId, String userId) {
        if (planId == null) {
            return Optional.empty();
        }
        PendingAudit entry = pending.get(planId);
        if (entry == null || !entry.userId().equals(userId)) {
            return Optional.empty();
        }
        return pending.remove(planId, entry) ? Optional.of(entry) : Optional.empty();
    }

    /**
     * Removes the user's entries created at or before {@code cutoff}.
     */
    public List<PendingAudit> removeForUser(String userId, Instant cutoff) {
        return removeIf(entry -> entry.userId().equals(userId) && !entry.createdAt().isAfter(cutoff));
    }

    /**
     * Removes every entry matching the predicate.
     */
    public List<PendingAudit> removeIf(Predicate<PendingAudit> predicate) {
        List<PendingAudit> removed = new ArrayList<>();
        for (var e : pending.entrySet()) {
            if (predicate.test(e.getValue()) && pending.remove(e.getKey(), e.getValue())) {
                removed.add(e.getValue());
            }
        }
        return removed;
    }

    public boolean contains(String planId) {
        return pending.containsKey(planId);
    }

    public int size() {
        return pending.size();
    }

    public Instant now() {
        return clock.instant();
    }
}
