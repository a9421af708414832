package com.codescout.core.navigation;

/**
 * Reason tag recorded for each dispatched navigation call.
 */
public enum ToolOutcome {
    OK("ok"),
    CACHED("cached"),
    NOT_FOUND("not_found"),
    OUTSIDE_SANDBOX("outside_sandbox"),
    INVALID_CALL("invalid_call"),
    BOUND_REACHED("bound_reached");

    private final String tag;

    ToolOutcome(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isError() {
        return this != OK && this != CACHED;
    }
}
