package com.sahayak.core.audit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "sahayak.audit")
public class AuditProperties {

    /** Pending entries younger than this survive a disconnect sweep, so a reconnecting client can still report. */
    private int pendingGraceSeconds = 30;

    /** Pending entries older than this are abandoned by the reaper. */
    private int pendingTtlSeconds = 300;

    /** Reaper period; 0 disables the reaper. */
    private int reaperIntervalSeconds = 60;

    public int getPendingGraceSeconds() {
        return pendingGraceSeconds;
    }

    public void setPendingGraceSeconds(int pendingGraceSeconds) {
        this.pendingGraceSeconds = pendingGraceSeconds;
    }

    public int getPendingTtlSeconds() {
        return pendingTtlSeconds;
    }

    public void setPendingTtlSeconds(int pendingTtlSeconds) {
        this.pendingTtlSeconds = pendingTtlSeconds;
    }

    public int getReaperIntervalSeconds() {
        return reaperIntervalSeconds;
    }

    public void setReaperIntervalSeconds(int reaperIntervalSeconds) {
        this.reaperIntervalSeconds = reaperIntervalSeconds;
    }
}
