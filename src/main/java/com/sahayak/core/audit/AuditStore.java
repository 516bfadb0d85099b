package com.sahayak.core.audit;

import com.sahayak.core.model.AuditRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only log of dispatched commands.
 */
public interface AuditStore {

    /**
     * Persists a new record.
     *
     * @return the record id
     * @throws AuditException when the record cannot be written
     */
    String append(AuditRecord record);

    /**
     * Sets the result of a record that is still {@code dispatched}. A record is
     * updated at most once.
     *
     * @return true when a record was changed
     * @throws AuditException when the store cannot be reached
     */
    boolean update(String id, String result, String error);

    Optional<AuditRecord> findById(String id);

    /**
     * Newest records first.
     */
    List<AuditRecord> findRecent(int limit);
}
