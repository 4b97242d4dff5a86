package org.neuralchilli.tickflow.domain;

/**
 * Kind of element in a workflow net.
 */
public enum NodeKind {
    /**
     * Unit of work; may require manual completion
     */
    TASK,

    /**
     * Intermediate condition (place); completes as soon as it is enabled
     */
    CONDITION,

    /**
     * Unique start of a case
     */
    INPUT_CONDITION,

    /**
     * End of a case; declared outputs must complete for a clean run
     */
    OUTPUT_CONDITION;

    /**
     * Conditions never wait for an external completion signal
     */
    public boolean isCondition() {
        return this != TASK;
    }

    public static NodeKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return TASK;
        }
        return NodeKind.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
