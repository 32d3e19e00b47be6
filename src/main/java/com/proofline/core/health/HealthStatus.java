package com.proofline.core.health;

import java.util.Map;

/**
 * Result of one readiness check run by {@code proofline health}.
 *
 * @param component "tool:&lt;kind&gt;" for a verification engine, "results-dir" for the output location
 * @param metadata  extra facts about the check, such as the configured executable
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /**
     * UP: usable. DOWN: missing or unwritable. DEGRADED: present but cannot be launched as
     * configured, for example an engine file without the execute permission.
     */
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public boolean isUp() {
        return status == Status.UP;
    }
}
