package com.bulwark.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Bulwark-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setCheck(String checkName) {
        MDC.put("check", checkName);
    }

    public static void clearCheck() {
        MDC.remove("check");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("check");
    }
}
