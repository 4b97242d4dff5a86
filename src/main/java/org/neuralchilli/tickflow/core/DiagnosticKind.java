package org.neuralchilli.tickflow.core;

/**
 * Kind of a non-fatal report produced during a tick or a run.
 */
public enum DiagnosticKind {
    /**
     * A node's activation could not be applied; the node was skipped
     */
    STRUCTURAL,

    /**
     * A node holds finished work that no catalog entry routes
     */
    AMBIGUOUS_PATTERN,

    /**
     * A cancellation and another change raced on the same node; the cancellation won
     */
    CANCELLATION_CONFLICT,

    /**
     * Two activations wanted the same unit of work; the later one retries next tick
     */
    CONTESTED_CONSUMPTION,

    /**
     * The run converged with an output condition never reached
     */
    DEADLOCK
}
