package com.sahayak.core.health;

import com.sahayak.core.planner.PlanGenerator;
import com.sahayak.core.ratelimit.CounterStore;
import com.sahayak.core.ratelimit.RedisCounterStore;
import com.sahayak.core.speech.SpeechSynthesizer;
import com.sahayak.core.speech.TranscriptionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Component health for the REST health endpoints. AI services are checked by
 * configuration only; no upstream calls are made. Redis is pinged only when it
 * backs the rate limiter, and is at worst DEGRADED since the limiter fails open.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DataSource dataSource;
    private final TranscriptionClient transcriptionClient;
    private final PlanGenerator planGenerator;
    private final SpeechSynthesizer speechSynthesizer;
    private final CounterStore counterStore;

    public HealthCheckService(
            @Autowired(required = false) DataSource dataSource,
            TranscriptionClient transcriptionClient,
            PlanGenerator planGenerator,
            SpeechSynthesizer speechSynthesizer,
            CounterStore counterStore) {
        this.dataSource = dataSource;
        this.counterStore = counterStore;
        this.transcriptionClient = transcriptionClient;
        this.planGenerator = planGenerator;
        this.speechSynthesizer = speechSynthesizer;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkDatabase());
        if (counterStore instanceof RedisCounterStore redis) {
            results.add(checkRedis(redis));
        }
        results.add(configured("stt", transcriptionClient.isConfigured(), "Deepgram"));
        results.add(configured("llm", planGenerator.isConfigured(), "Planner model " + planGenerator.modelName()));
        results.add(configured("tts", speechSynthesizer.isConfigured(), "ElevenLabs"));
        return results;
    }

    public HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.degraded("database", "No DataSource configured; audit records kept in memory");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid");
            }
            return HealthStatus.down("database", "Database connection invalid");
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database", "Database error: " + e.getMessage());
        }
    }

    HealthStatus checkRedis(RedisCounterStore redis) {
        try {
            String reply = redis.ping();
            if ("PONG".equalsIgnoreCase(reply)) {
                return HealthStatus.up("redis", "Redis reachable");
            }
            return HealthStatus.degraded("redis", "Unexpected PING reply: " + reply + "; rate limits not enforced");
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return HealthStatus.degraded("redis", "Redis error: " + e.getMessage() + "; rate limits not enforced");
        }
    }

    private HealthStatus configured(String component, boolean configured, String name) {
        if (configured) {
            return HealthStatus.up(component, name + " configured");
        }
        return HealthStatus.degraded(component, name + " not configured; fallback in use");
    }
}
