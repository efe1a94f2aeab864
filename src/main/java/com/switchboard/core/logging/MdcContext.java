package com.switchboard.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing Switchboard-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String SESSION_ID = "sessionId";
    public static final String USER_ID = "userId";
    public static final String MODE = "mode";

    private MdcContext() {}

    public static void setRequest(String requestId, String mode) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(MODE, mode);
    }

    public static void setSession(String userId, String sessionId) {
        putIfPresent(USER_ID, userId);
        putIfPresent(SESSION_ID, sessionId);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(SESSION_ID);
        MDC.remove(USER_ID);
        MDC.remove(MODE);
    }

    /**
     * Wraps {@code task} so it runs with the caller's current MDC. The worker
     * thread's own MDC is restored afterwards.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            replaceContext(captured);
            try {
                return task.call();
            } finally {
                replaceContext(previous);
            }
        };
    }

    private static void replaceContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        }
    }
}
