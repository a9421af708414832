package com.codescout.core.health;

import com.codescout.core.llm.EngineProperties;
import com.codescout.core.llm.ReasoningEngine;
import com.codescout.core.ratelimit.RateLimiterRegistry;
import com.codescout.core.session.FileSessionStore;
import com.codescout.core.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SessionStore sessionStore;
    private final RateLimiterRegistry rateLimiter;
    private final ReasoningEngine reasoningEngine;
    private final EngineProperties engineProperties;
    private final Instant startedAt = Instant.now();

    public HealthCheckService(
            @Autowired(required = false) SessionStore sessionStore,
            @Autowired(required = false) RateLimiterRegistry rateLimiter,
            @Autowired(required = false) ReasoningEngine reasoningEngine,
            @Autowired(required = false) EngineProperties engineProperties) {
        this.sessionStore = sessionStore;
        this.rateLimiter = rateLimiter;
        this.reasoningEngine = reasoningEngine;
        this.engineProperties = engineProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSessionStore());
        results.add(checkRateLimiter());
        results.add(checkReasoningEngine());
        return results;
    }

    public boolean allUp(List<HealthStatus> checks) {
        return checks.stream().allMatch(check -> check.status() == HealthStatus.Status.UP);
    }

    public Duration uptime() {
        return Duration.between(startedAt, Instant.now());
    }

    public int activeSessions() {
        return sessionStore != null ? sessionStore.activeLeases() : 0;
    }

    private HealthStatus checkSessionStore() {
        if (sessionStore == null) {
            return new HealthStatus("session_store", HealthStatus.Status.DOWN,
                    "No SessionStore configured", Map.of());
        }
        if (!(sessionStore instanceof FileSessionStore fileStore)) {
            return new HealthStatus("session_store", HealthStatus.Status.UP,
                    "SessionStore available (" + sessionStore.getClass().getSimpleName() + ")", Map.of());
        }
        Path directory = fileStore.directory();
        try {
            Files.createDirectories(directory);
            if (Files.isWritable(directory)) {
                return new HealthStatus("session_store", HealthStatus.Status.UP,
                        "Session directory writable", Map.of("directory", directory.toString()));
            }
            return new HealthStatus("session_store", HealthStatus.Status.DOWN,
                    "Session directory not writable", Map.of("directory", directory.toString()));
        } catch (IOException e) {
            log.warn("Session store health check failed: {}", e.getMessage());
            return new HealthStatus("session_store", HealthStatus.Status.DOWN,
                    "Session directory error: " + e.getMessage(), Map.of("directory", directory.toString()));
        }
    }

    private HealthStatus checkRateLimiter() {
        if (rateLimiter == null) {
            return new HealthStatus("rate_limiter", HealthStatus.Status.DOWN,
                    "No RateLimiterRegistry configured", Map.of());
        }
        if (!rateLimiter.isEnabled()) {
            return new HealthStatus("rate_limiter", HealthStatus.Status.UP,
                    "Admission control disabled", Map.of());
        }
        Map<String, String> buckets = new LinkedHashMap<>();
        rateLimiter.snapshot().forEach((category, tokens) ->
                buckets.put(category, String.format("%.1f", tokens)));
        return new HealthStatus("rate_limiter", HealthStatus.Status.UP,
                buckets.size() + " bucket(s) active", buckets);
    }

    private HealthStatus checkReasoningEngine() {
        if (reasoningEngine == null) {
            return new HealthStatus("reasoning_engine", HealthStatus.Status.DOWN,
                    "No ReasoningEngine configured", Map.of());
        }
        Map<String, String> metadata = engineProperties != null
                ? Map.of("model", engineProperties.getModel())
                : Map.of();
        return new HealthStatus("reasoning_engine", HealthStatus.Status.UP,
                "ReasoningEngine available (" + reasoningEngine.getClass().getSimpleName() + ")", metadata);
    }
}
