package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;

/**
 * A mutual-exclusion lock held by a node while it is ACTIVE.
 */
public record LockFact(String lock, NodeRef holder) implements Fact {

    public LockFact {
        if (lock == null || holder == null) {
            throw new IllegalArgumentException("Lock fact needs a lock name and a holder");
        }
    }

    @Override
    public String key() {
        return "lock:" + lock;
    }

    @Override
    public String nodeId() {
        return holder.nodeId();
    }
}
