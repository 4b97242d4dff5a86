package org.neuralchilli.tickflow.store;

/**
 * Presence means the join is spent; absence means it is armed.
 */
public record JoinFact(String nodeId, JoinState state) implements Fact {

    public JoinFact {
        if (nodeId == null || state == null) {
            throw new IllegalArgumentException("Join fact needs a node id and a state");
        }
    }

    @Override
    public String key() {
        return "join:" + nodeId;
    }
}
