package org.neuralchilli.tickflow.domain;

/**
 * Pattern-specific refinement of a join. {@link #STANDARD} defers to the
 * node's {@link JoinType}.
 */
public enum JoinBehavior {
    STANDARD,
    MULTI_MERGE,
    DISCRIMINATOR,
    BLOCKING_DISCRIMINATOR,
    CANCELLING_DISCRIMINATOR,
    PARTIAL,
    BLOCKING_PARTIAL,
    CANCELLING_PARTIAL,
    GENERALIZED_AND,
    LOCAL_SYNC_MERGE,
    GENERAL_SYNC_MERGE,
    THREAD_MERGE;

    public static JoinBehavior fromString(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        return JoinBehavior.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }

    /**
     * Behaviours that need a quorum value on the node
     */
    public boolean needsQuorum() {
        return this == PARTIAL || this == BLOCKING_PARTIAL
                || this == CANCELLING_PARTIAL || this == THREAD_MERGE;
    }

    /**
     * Behaviours that cancel the losing branches after firing
     */
    public boolean isCancelling() {
        return this == CANCELLING_DISCRIMINATOR || this == CANCELLING_PARTIAL;
    }
}
