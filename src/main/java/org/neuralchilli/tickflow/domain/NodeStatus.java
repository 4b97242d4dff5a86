package org.neuralchilli.tickflow.domain;

/**
 * Lifecycle status of a node (or of one instance of a node).
 */
public enum NodeStatus {
    /**
     * Not yet enabled
     */
    PENDING,

    /**
     * Enabled, work in progress
     */
    ACTIVE,

    /**
     * Work finished; may still hold a token waiting to be routed
     */
    COMPLETED,

    /**
     * Cancelled; terminal and irreversible
     */
    VOIDED;

    /**
     * Check if no further work can happen in the current iteration
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == VOIDED;
    }

    /**
     * Check if a transition to {@code next} is legal.
     * COMPLETED -> ACTIVE is the re-entry of a loop iteration.
     */
    public boolean canTransitionTo(NodeStatus next) {
        return switch (this) {
            case PENDING -> next == ACTIVE || next == VOIDED;
            case ACTIVE -> next == COMPLETED || next == VOIDED;
            case COMPLETED -> next == ACTIVE;
            case VOIDED -> false;
        };
    }

    /**
     * Precedence used when two contributions in one tick disagree on a ref's
     * next status. Cancellation always wins.
     */
    public int precedence() {
        return switch (this) {
            case VOIDED -> 3;
            case COMPLETED -> 2;
            case ACTIVE -> 1;
            case PENDING -> 0;
        };
    }
}
