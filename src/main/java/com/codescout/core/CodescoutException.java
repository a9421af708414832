package com.codescout.core;

/**
 * Base type for failures raised by the review core.
 * <p>
 * Every subclass reports a stable {@link #kind()} which is used as the
 * {@code error} field of tool results and API error bodies.
 */
public abstract class CodescoutException extends RuntimeException {

    protected CodescoutException(String message) {
        super(message);
    }

    protected CodescoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();
}
