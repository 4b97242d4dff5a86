package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.catalog.Threshold;
import org.neuralchilli.tickflow.catalog.VerbParameters.AwaitParameters;
import org.neuralchilli.tickflow.core.ReachabilityService;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.ArrivalUnit;
import org.neuralchilli.tickflow.store.Arrivals;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.JoinFact;
import org.neuralchilli.tickflow.store.JoinState;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * N -> 1 synchronization. For a join it weighs the units waiting in front of
 * the node against the threshold; for a multi-instance parent it records
 * instance completions against the group's threshold.
 */
public class AwaitVerb {

    private static final Logger log = LoggerFactory.getLogger(AwaitVerb.class);

    private final MultiInstanceManager instances;
    private final ReachabilityService reachability;

    public AwaitVerb(MultiInstanceManager instances, ReachabilityService reachability) {
        this.instances = instances;
        this.reachability = reachability;
    }

    public Delta apply(Snapshot snapshot, NodeRef subject, AwaitParameters params) {
        Node node = snapshot.node(subject.nodeId());
        if (node.isMultiInstance()) {
            return instanceJoin(snapshot, node, params);
        }
        return join(snapshot, node, params);
    }

    private Delta join(Snapshot snapshot, Node node, AwaitParameters params) {
        NodeRef ref = NodeRef.of(node.id());
        DeltaWriter writer = new DeltaWriter(snapshot);
        List<ArrivalUnit> units = Arrivals.waitingAt(snapshot, node.id());
        Set<String> predecessors = Arrivals.predecessorSet(snapshot, node.id());
        Optional<JoinState> spent = snapshot.marking().joinState(node.id());

        Optional<SignalFact> reset = snapshot.marking().signal(node.id(), SignalKind.RESET);
        if (reset.isPresent()) {
            writer.remove(reset.get());
            spent.ifPresent(state -> writer.remove(new JoinFact(node.id(), state)));
            log.debug("Join {} rearmed by reset signal", node.id());
            return writer.build();
        }

        if (spent.isPresent()) {
            return absorb(writer, node, units, predecessors, spent.get(), params.resetOnFire());
        }

        // Gates
        NodeStatus status = snapshot.status(ref);
        if (status == NodeStatus.ACTIVE || status == NodeStatus.VOIDED || snapshot.hasToken(ref)) {
            return Delta.EMPTY;
        }
        String milestone = node.options().milestone();
        if (milestone != null && snapshot.status(milestone) != NodeStatus.ACTIVE) {
            return Delta.EMPTY;
        }
        Optional<SignalFact> trigger = snapshot.marking().signal(node.id(), SignalKind.TRIGGER);
        if (node.options().trigger() != TriggerMode.NONE) {
            if (trigger.isEmpty()) {
                return Delta.EMPTY;
            }
            if (units.isEmpty() && node.options().trigger() == TriggerMode.TRANSIENT) {
                // Nobody is waiting: a transient trigger is lost
                log.debug("Transient trigger on {} lapsed", node.id());
                writer.remove(trigger.get());
                return writer.build();
            }
        }

        if (units.isEmpty()) {
            return Delta.EMPTY;
        }
        List<ArrivalUnit> consumed = select(snapshot, node, units, predecessors, params.threshold());
        if (consumed.isEmpty()) {
            return Delta.EMPTY;
        }

        consumed.forEach(u -> writer.remove(u.holder()));
        writer.activate(ref);
        trigger.ifPresent(writer::remove);
        snapshot.marking().branches(node.id()).forEach(writer::remove);

        Set<String> absorbed = new TreeSet<>();
        consumed.forEach(u -> absorbed.add(u.predecessor()));
        JoinState state = new JoinState(absorbed, consumed.get(0).predecessor());
        // A synchronizing merge has consumed every branch that could still arrive
        boolean settled = state.covers(predecessors)
                || params.threshold() == Threshold.ACTIVE || params.threshold() == Threshold.TOPOLOGY;
        if (!(params.resetOnFire() && settled)) {
            writer.add(new JoinFact(node.id(), state));
        }
        log.debug("Join {} fired on {} (winner {})", node.id(), absorbed, state.winner());
        return writer.build();
    }

    /**
     * Units to consume if the threshold is met, empty otherwise
     */
    private List<ArrivalUnit> select(
            Snapshot snapshot,
            Node node,
            List<ArrivalUnit> units,
            Set<String> predecessors,
            Threshold threshold
    ) {
        List<ArrivalUnit> firstEach = Arrivals.firstPerPredecessor(units);
        Set<String> arrived = Arrivals.arrivedPredecessors(units);

        return switch (threshold) {
            case ALL -> arrived.containsAll(predecessors) ? firstEach : List.of();
            case ONE -> List.of(units.get(0));
            case N -> {
                int quorum = quorum(node);
                if (node.options().joinBehavior() == JoinBehavior.THREAD_MERGE) {
                    yield units.size() >= quorum ? new ArrayList<>(units.subList(0, quorum)) : List.of();
                }
                yield arrived.size() >= quorum ? firstEach : List.of();
            }
            case ACTIVE -> {
                Set<String> opened = new TreeSet<>();
                snapshot.marking().branches(node.id()).forEach(b -> opened.add(b.predecessor()));
                for (String predecessor : predecessors) {
                    if (arrived.contains(predecessor)) {
                        continue;
                    }
                    // Without a recorded multi-choice, fall back to the branches still at work
                    boolean pending = opened.isEmpty()
                            ? isEnabled(snapshot, predecessor)
                            : opened.contains(predecessor) && reachability.canDeliver(snapshot, predecessor, node.id());
                    if (pending) {
                        yield List.of();
                    }
                }
                yield firstEach;
            }
            case TOPOLOGY -> {
                for (String predecessor : predecessors) {
                    if (!arrived.contains(predecessor)
                            && !reachability.isExhausted(snapshot, predecessor, node.id())) {
                        yield List.of();
                    }
                }
                yield firstEach;
            }
        };
    }

    /**
     * Spent join: consume late arrivals and rearm once every predecessor has been absorbed
     */
    private Delta absorb(
            DeltaWriter writer,
            Node node,
            List<ArrivalUnit> units,
            Set<String> predecessors,
            JoinState state,
            boolean resetOnFire
    ) {
        if (units.isEmpty()) {
            return Delta.EMPTY;
        }
        List<ArrivalUnit> late = Arrivals.firstPerPredecessor(units);
        late.forEach(u -> writer.remove(u.holder()));

        Set<String> arrived = new TreeSet<>();
        late.forEach(u -> arrived.add(u.predecessor()));
        JoinState next = state.absorb(arrived);

        writer.remove(new JoinFact(node.id(), state));
        if (resetOnFire && next.covers(predecessors)) {
            log.debug("Join {} rearmed after absorbing {}", node.id(), next.absorbed());
        } else {
            writer.add(new JoinFact(node.id(), next));
        }
        return writer.build();
    }

    private Delta instanceJoin(Snapshot snapshot, Node node, AwaitParameters params) {
        NodeRef parent = NodeRef.of(node.id());
        MultiInstanceGroup group = snapshot.marking().group(node.id())
                .orElseThrow(() -> new StructuralException(node.id(), "Instance join without an instance group"));

        DeltaWriter writer = new DeltaWriter(snapshot);
        Set<Integer> finished = new TreeSet<>();
        for (Integer instance : group.instances()) {
            NodeRef ref = NodeRef.of(node.id(), instance);
            if (snapshot.status(ref) == NodeStatus.COMPLETED && snapshot.hasToken(ref)) {
                writer.removeToken(ref);
                finished.add(instance);
            }
        }

        MultiInstanceGroup next = instances.recordCompletion(group, finished);
        Integer threshold = params.threshold() == Threshold.N ? group.threshold() : null;
        if (instances.isThresholdMet(next, threshold)) {
            writer.setStatus(parent, NodeStatus.COMPLETED);
            writer.addToken(parent);
            next = next.withThresholdMet();
            log.debug("Instances of {} met threshold ({}/{})", node.id(), next.completedCount(), next.size());
        }

        writer.remove(new GroupFact(group));
        boolean allDone = !next.accepting() && next.completedCount() == next.size();
        if (!(next.thresholdMet() && allDone)) {
            writer.add(new GroupFact(next));
        }
        return writer.build();
    }

    private int quorum(Node node) {
        Integer quorum = node.options().quorum();
        if (quorum == null) {
            throw new StructuralException(node.id(), "Quorum join without a quorum");
        }
        return quorum;
    }

    /**
     * A predecessor still doing work, or holding work it has not routed yet
     */
    private boolean isEnabled(Snapshot snapshot, String nodeId) {
        return snapshot.marking().tokenRefs().stream().anyMatch(r -> r.nodeId().equals(nodeId))
                || snapshot.marking().statuses().entrySet().stream()
                .anyMatch(e -> e.getKey().nodeId().equals(nodeId) && e.getValue() == NodeStatus.ACTIVE);
    }
}
