package org.neuralchilli.tickflow.store;

public record GroupFact(MultiInstanceGroup group) implements Fact {

    public GroupFact {
        if (group == null) {
            throw new IllegalArgumentException("Group fact needs a group");
        }
    }

    @Override
    public String key() {
        return "group:" + group.parentNode();
    }

    @Override
    public String nodeId() {
        return group.parentNode();
    }
}
