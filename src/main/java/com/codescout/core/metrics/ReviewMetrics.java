package com.codescout.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for reviews, tool dispatch, indexing and rate limiting.
 */
@Service
public class ReviewMetrics {

    private final MeterRegistry registry;

    public ReviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordReviewResult(String state) {
        Counter.builder("codescout.reviews.total")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordReviewDuration(Duration duration) {
        Timer.builder("codescout.review.duration")
                .register(registry)
                .record(duration);
    }

    public void recordToolCall(String tool, String reason) {
        Counter.builder("codescout.tool.calls")
                .description("Navigation tool calls dispatched for the reasoning engine")
                .tag("tool", tool)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records an index build or incremental update.
     *
     * @param unparsedFiles files that could not be decoded or scanned
     */
    public void recordIndexBuild(Duration duration, int unparsedFiles) {
        Timer.builder("codescout.index.build.duration")
                .register(registry)
                .record(duration);
        DistributionSummary.builder("codescout.index.unparsed")
                .register(registry)
                .record(unparsedFiles);
    }

    public void recordRateLimitWait(String category, Duration waited) {
        Timer.builder("codescout.ratelimit.wait")
                .tag("category", category)
                .register(registry)
                .record(waited);
    }

    public void recordRateLimitRejection(String category) {
        Counter.builder("codescout.ratelimit.rejections")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
