package org.neuralchilli.tickflow.domain;

import javax.annotation.Nonnull;

/**
 * A unit of enabled work sitting on a node (or on one instance of it).
 */
public record Token(String nodeId, Integer instanceId) {

    public Token {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("Token node id cannot be null or empty");
        }
    }

    public static Token on(NodeRef ref) {
        return new Token(ref.nodeId(), ref.instanceId());
    }

    public static Token on(String nodeId) {
        return new Token(nodeId, null);
    }

    public NodeRef ref() {
        return new NodeRef(nodeId, instanceId);
    }

    @Nonnull
    @Override
    public String toString() {
        return "Token[" + ref() + "]";
    }
}
