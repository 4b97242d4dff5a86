package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.Flow;

/**
 * A unit of work parked on a flow in front of a node that decides for itself
 * when to consume it (joins and guarded nodes).
 *
 * @param instance thread or instance id the unit belongs to, null for singletons
 */
public record ArrivalFact(String source, String target, Integer instance) implements Fact {

    public ArrivalFact {
        if (source == null || target == null) {
            throw new IllegalArgumentException("Arrival needs a source and a target");
        }
    }

    public String flowKey() {
        return Flow.key(source, target);
    }

    @Override
    public String key() {
        return "arrival:" + flowKey() + (instance != null ? "#" + instance : "");
    }

    @Override
    public String nodeId() {
        return target;
    }
}
