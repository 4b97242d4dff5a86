package org.neuralchilli.tickflow.store;

/**
 * Number of times a node has been activated in this case.
 */
public record VisitFact(String nodeId, int count) implements Fact {

    public VisitFact {
        if (nodeId == null) {
            throw new IllegalArgumentException("Visit fact needs a node id");
        }
        if (count < 1) {
            throw new IllegalArgumentException("Visit count must be positive, got: " + count);
        }
    }

    @Override
    public String key() {
        return "visit:" + nodeId;
    }
}
