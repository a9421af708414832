package com.codescout.core.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "codescout.rate-limit")
public class RateLimitProperties {

    private boolean enabled = true;
    private String tier = "tier1";
    private Duration waitCeiling = Duration.ofSeconds(30);
    private int defaultRpm = 100;
    private Map<String, ModelLimit> models = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(String tier) {
        this.tier = tier;
    }

    public Duration getWaitCeiling() {
        return waitCeiling;
    }

    public void setWaitCeiling(Duration waitCeiling) {
        this.waitCeiling = waitCeiling;
    }

    public int getDefaultRpm() {
        return defaultRpm;
    }

    public void setDefaultRpm(int defaultRpm) {
        this.defaultRpm = defaultRpm;
    }

    public Map<String, ModelLimit> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelLimit> models) {
        this.models = models;
    }

    public static class ModelLimit {

        private int rpm;
        private int burst;

        public ModelLimit() {
        }

        public ModelLimit(int rpm, int burst) {
            this.rpm = rpm;
            this.burst = burst;
        }

        public int getRpm() {
            return rpm;
        }

        public void setRpm(int rpm) {
            this.rpm = rpm;
        }

        public int getBurst() {
            return burst;
        }

        public void setBurst(int burst) {
            this.burst = burst;
        }
    }
}
