package org.neuralchilli.tickflow.store;

/**
 * A multi-choice routed work down a branch that reaches {@code join} through
 * {@code predecessor}. The structured synchronizing merge waits for exactly
 * these branches.
 */
public record BranchFact(String join, String predecessor) implements Fact {

    public BranchFact {
        if (join == null || predecessor == null) {
            throw new IllegalArgumentException("Branch needs a join and a predecessor");
        }
    }

    @Override
    public String key() {
        return "branch:" + join + ":" + predecessor;
    }

    @Override
    public String nodeId() {
        return join;
    }
}
