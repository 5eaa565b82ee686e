package com.sandcastle.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sandcastle-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SANDBOX_ID = "sandboxId";
    public static final String USER_ID = "userId";
    public static final String OPERATION = "operation";

    private MdcContext() {}

    public static void setOperation(String operation, String sandboxId) {
        MDC.put(OPERATION, operation);
        if (sandboxId != null) {
            MDC.put(SANDBOX_ID, sandboxId);
        }
    }

    public static void setSandbox(String sandboxId, String userId) {
        if (sandboxId != null) {
            MDC.put(SANDBOX_ID, sandboxId);
        }
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
    }

    public static void clear() {
        MDC.remove(SANDBOX_ID);
        MDC.remove(USER_ID);
        MDC.remove(OPERATION);
    }
}
