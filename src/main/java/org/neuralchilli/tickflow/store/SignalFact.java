package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.SignalKind;

import java.util.Comparator;

/**
 * An external signal addressed to a node, waiting to be consumed by a verb.
 *
 * @param argument optional payload, e.g. the chosen branch of a deferred choice
 * @param sequence delivery order; not part of the slot, so a repeated signal
 *                 still lands on the one it repeats
 */
public record SignalFact(String nodeId, SignalKind kind, String argument, long sequence) implements Fact {

    public static final Comparator<SignalFact> ARRIVAL_ORDER =
            Comparator.comparingLong(SignalFact::sequence).thenComparing(SignalFact::key);

    public SignalFact {
        if (nodeId == null || kind == null) {
            throw new IllegalArgumentException("Signal needs a node id and a kind");
        }
    }

    public SignalFact(String nodeId, SignalKind kind, String argument) {
        this(nodeId, kind, argument, 0L);
    }

    @Override
    public String key() {
        return "signal:" + nodeId + ":" + kind + (argument != null ? ":" + argument : "");
    }
}
