package com.warden.core.logging;

import com.warden.core.model.IsolationLevel;
import com.warden.core.model.SecurityContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRequest puts request, component, session and level in MDC")
    void setRequest() {
        var context = SecurityContext.builder("prompt-evolution")
                .requestId("req-7")
                .sessionId("s-1")
                .isolationLevel(IsolationLevel.MICRO_VM)
                .build();

        MdcContext.setRequest(context);

        assertEquals("req-7", MDC.get("requestId"));
        assertEquals("prompt-evolution", MDC.get("component"));
        assertEquals("s-1", MDC.get("sessionId"));
        assertEquals("MICRO_VM", MDC.get("isolationLevel"));
    }

    @Test
    @DisplayName("setIsolationLevel overrides the requested level")
    void setIsolationLevel() {
        MdcContext.setRequest(SecurityContext.builder("factor-mining").build());
        MdcContext.setIsolationLevel("NAMESPACE_SANDBOX");
        assertEquals("NAMESPACE_SANDBOX", MDC.get("isolationLevel"));
    }

    @Test
    @DisplayName("clear removes all warden MDC keys and leaves others alone")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setRequest(SecurityContext.builder("factor-mining").build());
        MdcContext.clear();
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("component"));
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("isolationLevel"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
