package com.sandcastle.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
        MDC.clear();
    }

    @Test
    @DisplayName("setOperation puts operation and sandboxId in MDC")
    void setOperation() {
        MdcContext.setOperation("start", "abc123def456");
        assertEquals("start", MDC.get("operation"));
        assertEquals("abc123def456", MDC.get("sandboxId"));
    }

    @Test
    @DisplayName("setOperation without a sandbox leaves sandboxId unset")
    void setOperationWithoutSandbox() {
        MdcContext.setOperation("create", null);
        assertEquals("create", MDC.get("operation"));
        assertNull(MDC.get("sandboxId"));
    }

    @Test
    @DisplayName("setSandbox puts sandboxId and userId in MDC")
    void setSandbox() {
        MdcContext.setSandbox("abc123def456", "alice");
        assertEquals("abc123def456", MDC.get("sandboxId"));
        assertEquals("alice", MDC.get("userId"));
    }

    @Test
    @DisplayName("clear removes all sandcastle MDC keys but keeps others")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setOperation("stop", "abc123def456");
        MdcContext.setSandbox("abc123def456", "alice");
        MdcContext.clear();
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("sandboxId"));
        assertNull(MDC.get("userId"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
