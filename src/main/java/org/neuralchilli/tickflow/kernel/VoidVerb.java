package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.catalog.CancellationScope;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.BranchFact;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Fact;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.JoinFact;
import org.neuralchilli.tickflow.store.LockFact;
import org.neuralchilli.tickflow.store.MarkerFact;
import org.neuralchilli.tickflow.store.MarkerKind;
import org.neuralchilli.tickflow.store.Marking;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cancellation. Voids every covered ref that has not completed and
 * withdraws the work (tokens, parked arrivals, locks) sitting on covered
 * refs. A completed ref keeps its status: history is never retracted.
 */
public class VoidVerb {

    private static final Logger log = LoggerFactory.getLogger(VoidVerb.class);

    private final MultiInstanceManager instances;

    public VoidVerb(MultiInstanceManager instances) {
        this.instances = instances;
    }

    public Delta apply(Snapshot snapshot, NodeRef subject, CancellationScope scope) {
        DeltaWriter writer = new DeltaWriter(snapshot);
        switch (scope) {
            case SELF -> voidSelf(writer, subject);
            case TASK -> voidTask(writer, subject);
            case INSTANCES -> voidInstances(writer, subject);
            case REGION -> voidRegion(writer, subject);
            case CASE -> voidCase(writer);
        }
        snapshot.marking().signals(subject.nodeId()).forEach(writer::remove);
        return writer.build();
    }

    private void voidSelf(DeltaWriter writer, NodeRef subject) {
        cancel(writer, subject);
        if (!subject.isInstance()) {
            clearNode(writer, subject.nodeId(), false);
        }
    }

    /**
     * The node, its nested sub-structure and every instance of them
     */
    private void voidTask(DeltaWriter writer, NodeRef subject) {
        Snapshot snapshot = writer.snapshot();
        Set<String> covered = new LinkedHashSet<>();
        covered.add(subject.nodeId());
        covered.addAll(snapshot.node(subject.nodeId()).options().nestedNodes());

        for (String nodeId : covered) {
            if (!snapshot.topology().hasNode(nodeId)) {
                throw new StructuralException(subject.nodeId(), "Nested node '" + nodeId + "' does not exist");
            }
            for (NodeRef ref : refsOf(snapshot, nodeId)) {
                cancel(writer, ref);
            }
            clearNode(writer, nodeId, true);
        }
        log.debug("Cancelled task {} (covering {})", subject.nodeId(), covered);
    }

    /**
     * Unfinished instances of the subject's group. Closes the group; a
     * parent that had not yet continued is completed (forced completion).
     */
    private void voidInstances(DeltaWriter writer, NodeRef subject) {
        Snapshot snapshot = writer.snapshot();
        String parentId = subject.nodeId();
        MultiInstanceGroup group = snapshot.marking().group(parentId)
                .orElseThrow(() -> new StructuralException(parentId, "No instance group to cancel"));

        for (Integer instance : group.instances()) {
            cancel(writer, NodeRef.of(parentId, instance));
        }

        GroupFact closing;
        try {
            closing = instances.closeGroup(group);
        } catch (IllegalStateException e) {
            throw new StructuralException(parentId, e.getMessage(), e);
        }
        writer.remove(closing);

        NodeRef parent = NodeRef.of(parentId);
        if (!group.thresholdMet() && snapshot.status(parent) == NodeStatus.ACTIVE) {
            writer.setStatus(parent, NodeStatus.COMPLETED);
            writer.addToken(parent);
            log.debug("Forced completion of {} with {}/{} instances done",
                    parentId, group.completedCount(), group.size());
        }
    }

    /**
     * The subject's declared region: node ids, and {@code source->target} flow keys
     */
    private void voidRegion(DeltaWriter writer, NodeRef subject) {
        Snapshot snapshot = writer.snapshot();
        Node node = snapshot.node(subject.nodeId());

        for (String target : node.cancellationTargets()) {
            if (target.contains("->")) {
                for (ArrivalFact arrival : snapshot.marking().allArrivals()) {
                    if (arrival.flowKey().equals(target)) {
                        writer.remove(arrival);
                    }
                }
                continue;
            }
            if (!snapshot.topology().hasNode(target)) {
                throw new StructuralException(node.id(), "Cancellation target '" + target + "' does not exist");
            }
            for (NodeRef ref : refsOf(snapshot, target)) {
                cancel(writer, ref);
            }
            clearNode(writer, target, false);
        }

        snapshot.marking().joinState(node.id())
                .ifPresent(state -> writer.remove(new JoinFact(node.id(), state)));
        MarkerFact marker = new MarkerFact(node.id(), MarkerKind.REGION_CANCELLED);
        if (!snapshot.marking().contains(marker)) {
            writer.add(marker);
        }
        log.debug("Cancelled region of {}: {}", node.id(), node.cancellationTargets());
    }

    private void voidCase(DeltaWriter writer) {
        Snapshot snapshot = writer.snapshot();
        Marking marking = snapshot.marking();
        for (Node node : snapshot.topology().nodes()) {
            for (NodeRef ref : refsOf(snapshot, node.id())) {
                cancel(writer, ref);
            }
        }
        for (Fact fact : marking.facts()) {
            if (fact instanceof ArrivalFact || fact instanceof LockFact || fact instanceof GroupFact
                    || fact instanceof JoinFact || fact instanceof SignalFact || fact instanceof BranchFact) {
                writer.remove(fact);
            }
        }
        log.debug("Cancelled case {}", snapshot.topology().workflow().name());
    }

    /**
     * Void one ref unless it has completed, and withdraw its token and locks
     */
    private void cancel(DeltaWriter writer, NodeRef ref) {
        Snapshot snapshot = writer.snapshot();
        NodeStatus status = snapshot.status(ref);
        writer.removeToken(ref);
        for (LockFact lock : snapshot.marking().locksHeldBy(ref)) {
            writer.remove(lock);
        }
        if (status != NodeStatus.COMPLETED && status != NodeStatus.VOIDED) {
            writer.setStatus(ref, NodeStatus.VOIDED);
        }
    }

    /**
     * Work parked in front of the node; with {@code includeGroup} also its instance group and join state
     */
    private void clearNode(DeltaWriter writer, String nodeId, boolean includeGroup) {
        Marking marking = writer.snapshot().marking();
        marking.arrivals(nodeId).forEach(writer::remove);
        if (includeGroup) {
            marking.group(nodeId).ifPresent(g -> writer.remove(new GroupFact(g)));
            marking.joinState(nodeId).ifPresent(s -> writer.remove(new JoinFact(nodeId, s)));
            marking.branches(nodeId).forEach(writer::remove);
        }
    }

    /**
     * Node-level ref plus every instance ref the marking knows about
     */
    private Set<NodeRef> refsOf(Snapshot snapshot, String nodeId) {
        Set<NodeRef> refs = new TreeSet<>(NodeRef.ORDER);
        refs.add(NodeRef.of(nodeId));
        snapshot.marking().statuses().keySet().stream()
                .filter(r -> r.nodeId().equals(nodeId))
                .forEach(refs::add);
        snapshot.marking().tokenRefs().stream()
                .filter(r -> r.nodeId().equals(nodeId))
                .forEach(refs::add);
        return refs;
    }
}
