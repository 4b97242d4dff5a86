package org.neuralchilli.tickflow.domain;

/**
 * How the instance count of a multi-instance task is known.
 */
public enum CreationMode {
    /**
     * Count fixed at design time
     */
    STATIC,

    /**
     * Count evaluated from case data when the task is enabled
     */
    DYNAMIC,

    /**
     * Instances added while the task runs, until NO_MORE_INSTANCES
     */
    INCREMENTAL;

    public static CreationMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return STATIC;
        }
        return CreationMode.valueOf(value.trim().toUpperCase());
    }
}
