package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Fact;
import org.neuralchilli.tickflow.store.MarkerFact;
import org.neuralchilli.tickflow.store.MarkerKind;
import org.neuralchilli.tickflow.store.Marking;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;
import org.neuralchilli.tickflow.store.VisitFact;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the delta of one verb call against one snapshot. Knows how to move
 * work along a flow while keeping the marking 1-safe per ref.
 */
public final class DeltaWriter {

    /**
     * Result of handing a unit of work to a flow's target
     */
    public enum Outcome {
        /**
         * Target activated
         */
        DELIVERED,

        /**
         * Parked on the flow in front of a gated target
         */
        PARKED,

        /**
         * Target is voided; the work is dropped with it
         */
        ABSORBED,

        /**
         * Target still holds work; the whole verb call must be retried next tick
         */
        BUSY
    }

    private final Snapshot snapshot;
    private final Delta.Builder builder = Delta.builder();
    private final Map<String, Integer> activations = new TreeMap<>();

    public DeltaWriter(Snapshot snapshot) {
        this.snapshot = snapshot;
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public DeltaWriter add(Fact fact) {
        builder.add(fact);
        return this;
    }

    public DeltaWriter remove(Fact fact) {
        builder.remove(fact);
        return this;
    }

    public DeltaWriter removeToken(NodeRef ref) {
        if (snapshot.hasToken(ref)) {
            builder.remove(TokenFact.on(ref));
        }
        return this;
    }

    public DeltaWriter addToken(NodeRef ref) {
        builder.add(TokenFact.on(ref));
        return this;
    }

    /**
     * Change a ref's status, retracting the old status fact
     */
    public DeltaWriter setStatus(NodeRef ref, NodeStatus next) {
        NodeStatus current = snapshot.status(ref);
        if (current == next) {
            return this;
        }
        if (current != NodeStatus.PENDING) {
            builder.remove(new StatusFact(ref, current));
        }
        builder.add(new StatusFact(ref, next));
        return this;
    }

    /**
     * Start a new activation: ACTIVE, token placed, visit counted, and the
     * node's region marker cleared for the new iteration.
     */
    public DeltaWriter activate(NodeRef ref) {
        setStatus(ref, NodeStatus.ACTIVE);
        addToken(ref);
        activations.merge(ref.nodeId(), 1, Integer::sum);
        MarkerFact marker = new MarkerFact(ref.nodeId(), MarkerKind.REGION_CANCELLED);
        if (snapshot.marking().contains(marker)) {
            builder.remove(marker);
        }
        return this;
    }

    /**
     * Hand one unit of work to the target of {@code flow}. The caller has
     * already retracted the unit from its source.
     *
     * @param instance thread or instance id carried along the flow
     */
    public Outcome deliver(Flow flow, Integer instance) {
        String target = flow.target();
        Marking marking = snapshot.marking();

        if (snapshot.topology().isGated(target)) {
            ArrivalFact arrival = new ArrivalFact(flow.source(), target, instance);
            if (marking.contains(arrival)) {
                return Outcome.BUSY;
            }
            builder.add(arrival);
            return Outcome.PARKED;
        }

        NodeRef ref = new NodeRef(target, instance);
        NodeStatus status = marking.status(ref);
        if (status == NodeStatus.VOIDED) {
            return Outcome.ABSORBED;
        }
        if (status == NodeStatus.ACTIVE && !flow.isSelfLoop()) {
            return Outcome.BUSY;
        }
        if (marking.hasToken(ref) && !flow.isSelfLoop()) {
            return Outcome.BUSY;
        }
        activate(ref);
        return Outcome.DELIVERED;
    }

    public boolean isEmpty() {
        return builder.isEmpty() && activations.isEmpty();
    }

    public Delta build() {
        Marking marking = snapshot.marking();
        activations.forEach((nodeId, count) -> {
            int visits = marking.visits(nodeId);
            if (visits > 0) {
                builder.remove(new VisitFact(nodeId, visits));
            }
            builder.add(new VisitFact(nodeId, visits + count));
        });
        return builder.build();
    }
}
