package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.catalog.SelectionMode;
import org.neuralchilli.tickflow.core.ExpressionContext;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.MutexSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.service.ExpressionException;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.ArrivalUnit;
import org.neuralchilli.tickflow.store.Arrivals;
import org.neuralchilli.tickflow.store.BranchFact;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.LockFact;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Selective routing. Chooses among outgoing flows by guard, by external
 * event or by loop condition; in mutex mode it chooses which contender for a
 * shared lock may start.
 */
public class FilterVerb {

    private static final Logger log = LoggerFactory.getLogger(FilterVerb.class);

    private final ExpressionEvaluator evaluator;

    public FilterVerb(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public Delta apply(Snapshot snapshot, NodeRef subject, SelectionMode mode) {
        return switch (mode) {
            case EXACTLY_ONE -> route(snapshot, subject, List.of(exactlyOne(snapshot, subject)));
            case ONE_OR_MORE -> multiChoice(snapshot, subject);
            case DEFERRED -> deferred(snapshot, subject);
            case MUTEX -> mutex(snapshot, subject);
            case LOOP_CONDITION -> route(snapshot, subject, List.of(loopCondition(snapshot, subject)));
        };
    }

    private Delta route(Snapshot snapshot, NodeRef subject, List<Flow> chosen) {
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        for (Flow flow : chosen) {
            if (writer.deliver(flow, subject.instanceId()) == DeltaWriter.Outcome.BUSY) {
                return Delta.EMPTY;
            }
        }
        return writer.build();
    }

    /**
     * Route every admissible branch and record, for structured merges
     * downstream, which branches are now on their way
     */
    private Delta multiChoice(Snapshot snapshot, NodeRef subject) {
        List<Flow> chosen = oneOrMore(snapshot, subject);
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        for (Flow flow : chosen) {
            if (writer.deliver(flow, subject.instanceId()) == DeltaWriter.Outcome.BUSY) {
                return Delta.EMPTY;
            }
        }
        Set<BranchFact> opened = new TreeSet<>(Comparator.comparing(BranchFact::key));
        chosen.forEach(flow -> opened.addAll(snapshot.topology().branchesOpenedBy(flow)));
        for (BranchFact branch : opened) {
            if (!snapshot.marking().contains(branch)) {
                writer.add(branch);
            }
        }
        log.debug("Multi-choice {} took {}", subject, chosen.stream().map(Flow::target).toList());
        return writer.build();
    }

    /**
     * First flow whose guard holds, in priority order; the default flow if none does
     */
    private Flow exactlyOne(Snapshot snapshot, NodeRef subject) {
        ExpressionContext context = evaluator.contextFor(snapshot, subject);
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        for (Flow flow : flows) {
            if (!flow.defaultFlow() && holds(flow, context)) {
                return flow;
            }
        }
        return flows.stream()
                .filter(Flow::defaultFlow)
                .findFirst()
                .orElseThrow(() -> new StructuralException(subject.nodeId(), "No admissible branch for exclusive choice"));
    }

    private List<Flow> oneOrMore(Snapshot snapshot, NodeRef subject) {
        ExpressionContext context = evaluator.contextFor(snapshot, subject);
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        List<Flow> chosen = new ArrayList<>();
        for (Flow flow : flows) {
            if (!flow.defaultFlow() && holds(flow, context)) {
                chosen.add(flow);
            }
        }
        if (chosen.isEmpty()) {
            flows.stream().filter(Flow::defaultFlow).forEach(chosen::add);
        }
        if (chosen.isEmpty()) {
            throw new StructuralException(subject.nodeId(), "No admissible branch for multi-choice");
        }
        return chosen;
    }

    /**
     * Loop back while the back edge's guard holds, otherwise take the exit
     */
    private Flow loopCondition(Snapshot snapshot, NodeRef subject) {
        ExpressionContext context = evaluator.contextFor(snapshot, subject);
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        Flow back = flows.stream()
                .filter(f -> f.loopBack() || f.isSelfLoop())
                .findFirst()
                .orElseThrow(() -> new StructuralException(subject.nodeId(), "Loop without a back edge"));

        if (holds(back, context)) {
            return back;
        }
        for (Flow flow : flows) {
            if (flow != back && holds(flow, context)) {
                return flow;
            }
        }
        throw new StructuralException(subject.nodeId(), "Loop guard is false and no exit flow is admissible");
    }

    /**
     * Wait for an EVENT naming one of the successors, then commit to it
     */
    private Delta deferred(Snapshot snapshot, NodeRef subject) {
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        DeltaWriter writer = new DeltaWriter(snapshot);

        for (SignalFact signal : snapshot.marking().signals(subject.nodeId())) {
            if (signal.kind() != SignalKind.EVENT) {
                continue;
            }
            Optional<Flow> chosen = flows.stream()
                    .filter(f -> f.target().equals(signal.argument()))
                    .findFirst();
            if (chosen.isEmpty()) {
                log.warn("Discarding event for {}: '{}' is not one of its branches", subject, signal.argument());
                writer.remove(signal);
                continue;
            }
            writer.remove(signal);
            writer.removeToken(subject);
            if (writer.deliver(chosen.get(), subject.instanceId()) == DeltaWriter.Outcome.BUSY) {
                return Delta.EMPTY;
            }
            log.debug("Deferred choice {} resolved to {}", subject, chosen.get().target());
            return writer.build();
        }
        // No event yet: only stale events to discard, if any
        return writer.build();
    }

    /**
     * Start the subject if it is the deterministic winner among the idle
     * contenders for its lock and the lock is free. Losers keep their
     * waiting work and retry once the lock is released.
     */
    private Delta mutex(Snapshot snapshot, NodeRef subject) {
        Node node = snapshot.node(subject.nodeId());
        MutexSpec mutex = node.options().mutex();
        if (mutex == null) {
            throw new StructuralException(node.id(), "Mutex selection on a node without a lock");
        }
        if (snapshot.marking().lock(mutex.lock()).isPresent()) {
            return Delta.EMPTY;
        }

        String winner = null;
        for (Node contender : snapshot.topology().lockMembers(mutex.lock())) {
            if (isIdle(snapshot, contender.id()) && !Arrivals.waitingAt(snapshot, contender.id()).isEmpty()) {
                winner = contender.id();
                break;
            }
        }
        if (!node.id().equals(winner)) {
            return Delta.EMPTY;
        }

        ArrivalUnit unit = Arrivals.waitingAt(snapshot, node.id()).get(0);
        NodeRef ref = NodeRef.of(node.id());
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.remove(unit.holder());
        writer.activate(ref);
        writer.add(new LockFact(mutex.lock(), ref));
        log.debug("{} acquired lock {}", ref, mutex.lock());
        return writer.build();
    }

    private boolean isIdle(Snapshot snapshot, String nodeId) {
        NodeRef ref = NodeRef.of(nodeId);
        NodeStatus status = snapshot.status(ref);
        return status != NodeStatus.ACTIVE && status != NodeStatus.VOIDED && !snapshot.hasToken(ref);
    }

    /**
     * A guard that cannot be evaluated counts as false
     */
    private boolean holds(Flow flow, ExpressionContext context) {
        try {
            return evaluator.evaluateBoolean(flow.predicate(), context);
        } catch (ExpressionException e) {
            log.warn("Guard on {} treated as false: {}", flow.key(), e.getMessage());
            return false;
        }
    }
}
