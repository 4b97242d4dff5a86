package org.neuralchilli.tickflow.domain;

/**
 * How a node reacts to external TRIGGER signals.
 */
public enum TriggerMode {
    NONE,
    /**
     * A trigger that arrives while the node is not waiting is lost
     */
    TRANSIENT,
    /**
     * A trigger is kept until the node is ready to consume it
     */
    PERSISTENT;

    public static TriggerMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return TriggerMode.valueOf(value.trim().toUpperCase());
    }
}
