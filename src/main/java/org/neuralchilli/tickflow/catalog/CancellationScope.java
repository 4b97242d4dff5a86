package org.neuralchilli.tickflow.catalog;

/**
 * What a Void clears.
 */
public enum CancellationScope {
    /**
     * Only the subject
     */
    SELF,

    /**
     * The subject node, its nested sub-structure and its instances
     */
    TASK,

    /**
     * Unfinished instances of the subject's multi-instance group
     */
    INSTANCES,

    /**
     * The subject's declared cancellation region
     */
    REGION,

    /**
     * The whole case
     */
    CASE;

    public static CancellationScope fromString(String value) {
        return CancellationScope.valueOf(value.trim().toUpperCase());
    }
}
