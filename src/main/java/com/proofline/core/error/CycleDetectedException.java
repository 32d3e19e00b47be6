package com.proofline.core.error;

import java.util.List;

/**
 * The dependency relation of the task table contains a cycle.
 */
public class CycleDetectedException extends ConfigurationException {

    private final List<String> cycle;

    /**
     * @param cycle task names along the cycle, first and last element equal (e.g. [A, B, A])
     */
    public CycleDetectedException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
