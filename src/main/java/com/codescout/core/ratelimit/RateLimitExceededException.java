package com.codescout.core.ratelimit;

import com.codescout.core.CodescoutException;

import java.time.Duration;

/**
 * No token became available for a category within the allowed wait.
 */
public class RateLimitExceededException extends CodescoutException {

    private final String category;

    public RateLimitExceededException(String category, Duration maxWait) {
        super("Rate limit for " + category + " not available within " + maxWait.toMillis() + " ms");
        this.category = category;
    }

    public String category() {
        return category;
    }

    @Override
    public String kind() {
        return "rate_limit_exceeded";
    }
}
