package com.proofline.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Proofline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String TASK_KIND = "taskKind";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setTask(String sessionId, String taskId, String taskKind) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(TASK_ID, taskId);
        MDC.put(TASK_KIND, taskKind);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(TASK_KIND);
    }
}
