package com.codescout.core.ratelimit;

import com.codescout.core.metrics.ReviewMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared admission control for reasoning-engine calls, one {@link RateBucket}
 * per {@code tier:model-prefix} category.
 */
@Service
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final RateLimitProperties properties;
    private final ModelRateLimits limits;
    private final ReviewMetrics metrics;
    private final Map<String, RateBucket> buckets = new ConcurrentHashMap<>();

    public RateLimiterRegistry(RateLimitProperties properties, ReviewMetrics metrics) {
        this.properties = properties;
        this.limits = new ModelRateLimits(properties.getModels(), properties.getDefaultRpm());
        this.metrics = metrics;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public String categoryOf(String model) {
        return properties.getTier() + ":" + limits.limitFor(model, properties.getTier()).prefix();
    }

    public RateBucket bucketFor(String model) {
        ModelRateLimits.Limit limit = limits.limitFor(model, properties.getTier());
        String category = properties.getTier() + ":" + limit.prefix();
        return buckets.computeIfAbsent(category,
                key -> new RateBucket(key, limit.capacity(), limit.rpm() / 60.0));
    }

    /**
     * Blocks until a call to {@code model} is admitted.
     *
     * @throws RateLimitExceededException if the wait ceiling would be exceeded
     * @throws InterruptedException       if interrupted while waiting
     */
    public void acquire(String model) throws InterruptedException {
        if (!properties.isEnabled()) {
            return;
        }
        RateBucket bucket = bucketFor(model);
        try {
            Duration waited = bucket.acquire(properties.getWaitCeiling());
            if (!waited.isZero()) {
                log.warn("Rate limit wait of {} ms for {}", waited.toMillis(), bucket.category());
            }
            metrics.recordRateLimitWait(bucket.category(), waited);
        } catch (RateLimitExceededException e) {
            metrics.recordRateLimitRejection(bucket.category());
            throw e;
        }
    }

    /** Available tokens per category created so far. */
    public Map<String, Double> snapshot() {
        Map<String, Double> view = new TreeMap<>();
        buckets.forEach((category, bucket) -> view.put(category, bucket.availableTokens()));
        return view;
    }
}
