package com.sahayak.core.audit;

import com.sahayak.core.model.AuditRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link AuditStore} used when no database is configured.
 */
public class InMemoryAuditStore implements AuditStore {

    private final Map<String, AuditRecord> records = new ConcurrentHashMap<>();

    @Override
    public String append(AuditRecord record) {
        String id = record.id() != null ? record.id() : UUID.randomUUID().toString();
        Instant createdAt = record.createdAt() != null ? record.createdAt() : Instant.now();
        records.put(id, new AuditRecord(id, record.userId(), record.commandText(), record.actionJson(),
                record.result(), record.error(), createdAt));
        return id;
    }

    @Override
    public boolean update(String id, String result, String error) {
        boolean[] updated = {false};
        records.computeIfPresent(id, (key, existing) -> {
            if (!existing.isDispatched()) {
                return existing;
            }
            updated[0] = true;
            return existing.withResult(result, error);
        });
        return updated[0];
    }

    @Override
    public Optional<AuditRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<AuditRecord> findRecent(int limit) {
        return records.values().stream()
                .sorted(Comparator.comparing(AuditRecord::createdAt).reversed())
                .limit(limit)
                .toList();
    }
}
