package com.codescout.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Codescout-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setReview(String reviewId, String sessionName, String projectRoot) {
        MDC.put("reviewId", reviewId);
        MDC.put("sessionName", sessionName);
        MDC.put("projectRoot", projectRoot);
    }

    public static void clear() {
        MDC.remove("reviewId");
        MDC.remove("sessionName");
        MDC.remove("projectRoot");
    }
}
