package com.sahayak.core.audit;

import com.sahayak.core.session.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically abandons pending audits that can no longer be resolved: entries
 * past their TTL, and entries past the grace period whose owner is not connected.
 */
@Component
public class PendingAuditReaper {

    private static final Logger log = LoggerFactory.getLogger(PendingAuditReaper.class);

    private final PendingAuditIndex pendingIndex;
    private final AuditRecorder recorder;
    private final ConnectionRegistry registry;
    private final AuditProperties properties;
    private ScheduledExecutorService scheduler;

    public PendingAuditReaper(PendingAuditIndex pendingIndex, AuditRecorder recorder,
                              ConnectionRegistry registry, AuditProperties properties) {
        this.pendingIndex = pendingIndex;
        this.recorder = recorder;
        this.registry = registry;
        this.properties = properties;
    }

    @PostConstruct
    void start() {
        int interval = properties.getReaperIntervalSeconds();
        if (interval <= 0) {
            log.info("Pending audit reaper disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pending-audit-reaper");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::safeReap, interval, interval, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * @return number of entries abandoned
     */
    public int reap() {
        var now = pendingIndex.now();
        var expired = now.minus(Duration.ofSeconds(properties.getPendingTtlSeconds()));
        var graceOver = now.minus(Duration.ofSeconds(properties.getPendingGraceSeconds()));
        var removed = pendingIndex.removeIf(entry -> !entry.createdAt().isAfter(expired)
                || (!entry.createdAt().isAfter(graceOver) && !registry.isConnected(entry.userId())));
        return recorder.abandon(removed);
    }

    private void safeReap() {
        try {
            reap();
        } catch (RuntimeException e) {
            log.warn("Pending audit sweep failed: {}", e.getMessage(), e);
        }
    }
}
