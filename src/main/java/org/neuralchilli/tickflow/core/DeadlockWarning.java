package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.domain.NodeStatus;

import javax.annotation.Nonnull;

/**
 * The run converged but an output condition of the case was never reached.
 * A workflow-level failure, not an engine error.
 */
public record DeadlockWarning(String nodeId, NodeStatus status) {

    @Nonnull
    @Override
    public String toString() {
        return "Output condition '" + nodeId + "' not reached (status " + status + ")";
    }
}
