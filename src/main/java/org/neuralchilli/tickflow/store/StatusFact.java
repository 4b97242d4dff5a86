package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;

/**
 * Status of a node or instance. A ref without a status fact is PENDING.
 */
public record StatusFact(NodeRef ref, NodeStatus status) implements Fact {

    public StatusFact {
        if (ref == null || status == null) {
            throw new IllegalArgumentException("Status fact needs a ref and a status");
        }
        if (status == NodeStatus.PENDING) {
            throw new IllegalArgumentException("PENDING is implicit and never stored: " + ref);
        }
    }

    @Override
    public String key() {
        return "status:" + ref;
    }

    @Override
    public String nodeId() {
        return ref.nodeId();
    }
}
