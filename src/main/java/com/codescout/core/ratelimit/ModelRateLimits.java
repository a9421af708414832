package com.codescout.core.ratelimit;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Requests-per-minute table keyed by model-name prefix.
 * <p>
 * Configured entries override the built-in tier-1 defaults. Lookup picks the
 * longest matching prefix; models matching nothing share the {@code default} bucket.
 */
public class ModelRateLimits {

    public static final String SUPPORTED_TIER = "tier1";
    public static final String DEFAULT_KEY = "default";

    private static final Map<String, Integer> TIER1_DEFAULTS = Map.of(
            "gemini-2.5-pro", 150,
            "gemini-2.5-flash", 1000,
            "gemini-2.0-flash", 2000,
            "gemini-2.0-flash-lite", 4000,
            "gpt-4o", 500,
            "gpt-4o-mini", 1000,
            "claude-sonnet-4", 50,
            "claude-opus-4", 50
    );

    public record Limit(String prefix, int rpm, int burst) {
        public int capacity() {
            return burst > 0 ? burst : rpm;
        }
    }

    private final Map<String, Limit> limits = new LinkedHashMap<>();
    private final Limit defaultLimit;

    public ModelRateLimits(Map<String, RateLimitProperties.ModelLimit> configured, int defaultRpm) {
        TIER1_DEFAULTS.forEach((prefix, rpm) -> limits.put(prefix, new Limit(prefix, rpm, 0)));
        if (configured != null) {
            configured.forEach((prefix, limit) -> limits.put(prefix, new Limit(prefix, limit.getRpm(), limit.getBurst())));
        }
        Limit configuredDefault = limits.remove(DEFAULT_KEY);
        this.defaultLimit = configuredDefault != null ? configuredDefault : new Limit(DEFAULT_KEY, defaultRpm, 0);
    }

    /**
     * @throws IllegalArgumentException for any tier other than {@value #SUPPORTED_TIER}
     */
    public Limit limitFor(String model, String tier) {
        if (!SUPPORTED_TIER.equals(tier)) {
            throw new IllegalArgumentException("Unsupported rate-limit tier: " + tier);
        }
        if (model == null) {
            return defaultLimit;
        }
        return limits.values().stream()
                .filter(limit -> model.startsWith(limit.prefix()))
                .max(Comparator.comparingInt(limit -> limit.prefix().length()))
                .orElse(defaultLimit);
    }
}
