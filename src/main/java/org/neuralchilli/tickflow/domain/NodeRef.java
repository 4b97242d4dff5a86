package org.neuralchilli.tickflow.domain;

import javax.annotation.Nonnull;
import java.util.Comparator;

/**
 * Address of a node or of one instance of a node.
 * A null instance id refers to the node itself.
 */
public record NodeRef(String nodeId, Integer instanceId) {

    public static final Comparator<NodeRef> ORDER = Comparator
            .comparing(NodeRef::nodeId)
            .thenComparing(NodeRef::instanceId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public NodeRef {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (instanceId != null && instanceId < 0) {
            throw new IllegalArgumentException("Instance id cannot be negative: " + instanceId);
        }
    }

    public static NodeRef of(String nodeId) {
        return new NodeRef(nodeId, null);
    }

    public static NodeRef of(String nodeId, int instanceId) {
        return new NodeRef(nodeId, instanceId);
    }

    public boolean isInstance() {
        return instanceId != null;
    }

    /**
     * Same instance id, different node. Used when a thread moves along a flow.
     */
    public NodeRef moveTo(String targetNodeId) {
        return new NodeRef(targetNodeId, instanceId);
    }

    @Nonnull
    @Override
    public String toString() {
        return instanceId == null ? nodeId : nodeId + "[" + instanceId + "]";
    }
}
