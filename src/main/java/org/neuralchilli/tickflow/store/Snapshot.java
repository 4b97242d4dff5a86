package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;

import java.util.Map;

/**
 * Read-consistent view of one generation of the store. Every verb in a tick
 * reads the same snapshot.
 */
public record Snapshot(long generation, Topology topology, Marking marking) {

    public Node node(String id) {
        return topology.node(id);
    }

    public NodeStatus status(NodeRef ref) {
        return marking.status(ref);
    }

    public NodeStatus status(String nodeId) {
        return marking.status(NodeRef.of(nodeId));
    }

    public boolean hasToken(NodeRef ref) {
        return marking.hasToken(ref);
    }

    /**
     * Case data predicates are evaluated against
     */
    public Map<String, Object> data() {
        return topology.workflow().data();
    }
}
