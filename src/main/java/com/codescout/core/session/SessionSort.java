package com.codescout.core.session;

import java.util.Comparator;
import java.util.Locale;

public enum SessionSort {
    LAST_UPDATED(Comparator.comparing(SessionSummary::lastUpdated).reversed()),
    CREATED(Comparator.comparing(SessionSummary::createdAt).reversed()),
    NAME(Comparator.comparing(SessionSummary::name)),
    ITERATIONS(Comparator.comparingInt(SessionSummary::iterationCount).reversed());

    private final Comparator<SessionSummary> order;

    SessionSort(Comparator<SessionSummary> order) {
        this.order = order;
    }

    public Comparator<SessionSummary> order() {
        return order.thenComparing(SessionSummary::projectRoot).thenComparing(SessionSummary::name);
    }

    /**
     * Accepts {@code last_updated}, {@code last-updated} or {@code LAST_UPDATED}.
     *
     * @throws IllegalArgumentException for unknown keys
     */
    public static SessionSort parse(String value) {
        if (value == null || value.isBlank()) {
            return LAST_UPDATED;
        }
        return valueOf(value.strip().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
