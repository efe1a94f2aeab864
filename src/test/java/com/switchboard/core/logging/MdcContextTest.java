package com.switchboard.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void setRequestPopulatesIdAndMode() {
        MdcContext.setRequest("SWB-2026-000001", "hybrid");

        assertEquals("SWB-2026-000001", MDC.get(MdcContext.REQUEST_ID));
        assertEquals("hybrid", MDC.get(MdcContext.MODE));
    }

    @Test
    void setSessionSkipsBlankValues() {
        MdcContext.setSession("alice", "  ");

        assertEquals("alice", MDC.get(MdcContext.USER_ID));
        assertNull(MDC.get(MdcContext.SESSION_ID));
    }

    @Test
    void clearRemovesOnlySwitchboardKeys() {
        MDC.put("other", "kept");
        MdcContext.setRequest("SWB-2026-000002", "rules");
        MdcContext.setSession("bob", "s-1");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.REQUEST_ID));
        assertNull(MDC.get(MdcContext.MODE));
        assertNull(MDC.get(MdcContext.USER_ID));
        assertNull(MDC.get(MdcContext.SESSION_ID));
        assertEquals("kept", MDC.get("other"));
    }

    @Test
    void propagateCarriesCallerContextAndRestoresWorker() throws Exception {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            worker.submit(() -> MDC.put("worker", "own")).get(5, TimeUnit.SECONDS);
            MdcContext.setRequest("SWB-2026-000003", "generative");

            Callable<String> task = MdcContext.propagate(
                    () -> MDC.get(MdcContext.REQUEST_ID) + "/" + MDC.get("worker"));

            assertEquals("SWB-2026-000003/null", worker.submit(task).get(5, TimeUnit.SECONDS));
            assertEquals("own", worker.submit(() -> MDC.get("worker")).get(5, TimeUnit.SECONDS));
            assertNull(worker.submit(() -> MDC.get(MdcContext.REQUEST_ID)).get(5, TimeUnit.SECONDS));
        } finally {
            worker.shutdownNow();
        }
    }
}
