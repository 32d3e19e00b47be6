package com.proofline.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a verification session, used for CLI progress output.
 *
 * @param eventType event type (e.g. "session.started", "task.started", "task.cascaded")
 * @param sessionId the session this event belongs to
 * @param taskId    the task this event relates to (nullable for session-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SessionEvent(
    String eventType,
    String sessionId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SESSION_STARTED = "session.started";
    public static final String SESSION_COMPLETED = "session.completed";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_SUCCEEDED = "task.succeeded";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_TIMED_OUT = "task.timed_out";
    public static final String TASK_CASCADED = "task.cascaded";
    public static final String TASK_ABORTED = "task.aborted";
}
