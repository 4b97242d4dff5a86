package org.neuralchilli.tickflow.store;

/**
 * Node-local markers that record a one-shot action has happened
 */
public enum MarkerKind {
    /**
     * The node's cancellation region has been cleared for the current activation
     */
    REGION_CANCELLED
}
