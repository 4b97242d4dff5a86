package org.neuralchilli.tickflow.store;

public record MarkerFact(String nodeId, MarkerKind kind) implements Fact {

    public MarkerFact {
        if (nodeId == null || kind == null) {
            throw new IllegalArgumentException("Marker needs a node id and a kind");
        }
    }

    @Override
    public String key() {
        return "marker:" + nodeId + ":" + kind;
    }
}
