package com.ralphtown.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Ralphtown-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId, String repoId) {
        MDC.put("sessionId", sessionId);
        MDC.put("repoId", repoId);
    }

    public static void setClone(String url) {
        MDC.put("cloneUrl", url);
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("repoId");
        MDC.remove("cloneUrl");
    }
}
