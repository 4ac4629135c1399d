package com.warden.core.logging;

import com.warden.core.model.SecurityContext;
import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(SecurityContext context) {
        MDC.put("requestId", context.requestId());
        MDC.put("component", context.componentName());
        MDC.put("sessionId", context.sessionId());
        MDC.put("isolationLevel", context.isolationLevel().name());
    }

    public static void setIsolationLevel(String level) {
        MDC.put("isolationLevel", level);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("component");
        MDC.remove("sessionId");
        MDC.remove("isolationLevel");
    }
}
