package org.neuralchilli.tickflow.catalog;

import org.neuralchilli.tickflow.domain.CreationMode;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.MutexKind;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeKind;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.kernel.MultiInstanceManager;
import org.neuralchilli.tickflow.service.AmbiguousPatternException;
import org.neuralchilli.tickflow.store.Arrivals;
import org.neuralchilli.tickflow.store.MarkerKind;
import org.neuralchilli.tickflow.store.Marking;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.Topology;

import java.util.List;
import java.util.Optional;

/**
 * Matches a subject's local shape against the catalog, first match wins.
 * Trigger evaluation is a closed switch over {@link Trigger}; the catalog
 * only decides order and parameters.
 */
public class PatternResolver {

    private final PatternCatalog catalog;
    private final MultiInstanceManager instances;

    public PatternResolver(PatternCatalog catalog, MultiInstanceManager instances) {
        this.catalog = catalog;
        this.instances = instances;
    }

    public PatternCatalog catalog() {
        return catalog;
    }

    /**
     * Resolve the pattern that handles {@code subject} this tick.
     *
     * @return empty if the subject is inert
     * @throws AmbiguousPatternException if the subject holds finished work no entry can route
     */
    public Optional<Resolution> resolve(Snapshot snapshot, NodeRef subject) {
        Shape shape = new Shape(snapshot, subject);
        for (PatternMapping mapping : catalog.mappings()) {
            if (matches(mapping.trigger(), shape)) {
                return Optional.of(new Resolution(subject, mapping));
            }
        }
        if (shape.doneWithToken() && !shape.waitsOnGatedTarget() && !shape.isSynchronizedInstance()) {
            throw new AmbiguousPatternException(subject.nodeId(),
                    "No pattern matches completed " + subject + " (split " + shape.node.split()
                            + ", " + shape.flowsOut.size() + " outgoing flows)");
        }
        return Optional.empty();
    }

    boolean matches(Trigger trigger, Shape s) {
        Node n = s.node;
        JoinBehavior behavior = n.options().joinBehavior();
        return switch (trigger) {
            case CASE_CANCEL -> s.nodeLevel && s.signalled(SignalKind.CANCEL_CASE);
            case EXPLICIT_TERMINATION -> s.nodeLevel && n.kind() == NodeKind.OUTPUT_CONDITION
                    && n.options().terminatesCase() && s.doneWithToken();
            case MI_CANCEL -> s.nodeLevel && n.isMultiInstance() && s.signalled(SignalKind.CANCEL);
            case TASK_CANCEL -> s.nodeLevel && s.signalled(SignalKind.CANCEL);
            case DEADLINE -> s.nodeLevel && s.signalled(SignalKind.DEADLINE);
            case MI_FORCE_COMPLETE -> s.parentLevel() && s.signalled(SignalKind.COMPLETE_INSTANCES)
                    && s.group.isPresent() && !s.group.get().accepting() && !s.group.get().thresholdMet()
                    && s.status == NodeStatus.ACTIVE;
            case CANCELLING_DISCRIMINATOR_CLEANUP -> s.nodeLevel
                    && behavior == JoinBehavior.CANCELLING_DISCRIMINATOR && s.spent();
            case CANCELLING_PARTIAL_CLEANUP -> s.nodeLevel
                    && behavior == JoinBehavior.CANCELLING_PARTIAL && s.spent();
            case MI_CANCELLING_PARTIAL_CLEANUP -> s.parentLevel() && s.group.isPresent()
                    && s.group.get().thresholdMet() && !s.group.get().accepting()
                    && n.options().instances().cancelRemaining()
                    && !instances.unfinished(s.snapshot, s.group.get()).isEmpty();
            case MI_UNSYNCHRONIZED_INSTANCE_DONE -> s.instanceLevel() && s.group.isPresent()
                    && !s.group.get().synchronize() && s.doneWithToken();
            case MI_LATE_INSTANCE -> s.instanceLevel() && s.group.isPresent()
                    && s.group.get().thresholdMet() && s.doneWithToken();
            case MI_GROUP_SETTLED -> s.parentLevel() && s.group.isPresent()
                    && (s.group.get().thresholdMet() || !s.group.get().synchronize())
                    && !s.group.get().accepting() && instances.isSettled(s.snapshot, s.group.get());
            case STRUCTURED_DISCRIMINATOR -> s.joinReady(JoinBehavior.DISCRIMINATOR);
            case BLOCKING_DISCRIMINATOR -> s.joinReady(JoinBehavior.BLOCKING_DISCRIMINATOR);
            case CANCELLING_DISCRIMINATOR -> s.joinReady(JoinBehavior.CANCELLING_DISCRIMINATOR);
            case STRUCTURED_PARTIAL_JOIN -> s.joinReady(JoinBehavior.PARTIAL);
            case BLOCKING_PARTIAL_JOIN -> s.joinReady(JoinBehavior.BLOCKING_PARTIAL);
            case CANCELLING_PARTIAL_JOIN -> s.joinReady(JoinBehavior.CANCELLING_PARTIAL);
            case GENERALIZED_AND_JOIN -> s.joinReady(JoinBehavior.GENERALIZED_AND);
            case THREAD_MERGE -> s.joinReady(JoinBehavior.THREAD_MERGE);
            case GENERAL_SYNC_MERGE -> s.joinReady(JoinBehavior.GENERAL_SYNC_MERGE);
            case LOCAL_SYNC_MERGE -> s.joinReady(JoinBehavior.LOCAL_SYNC_MERGE);
            case STRUCTURED_SYNC_MERGE -> n.join() == JoinType.OR && s.joinReady(JoinBehavior.STANDARD);
            case SYNCHRONIZATION -> n.join() == JoinType.AND && s.joinReady(JoinBehavior.STANDARD);
            case MILESTONE -> s.nodeLevel && n.options().milestone() != null && s.hasUnits();
            case TRANSIENT_TRIGGER -> s.nodeLevel && n.options().trigger() == TriggerMode.TRANSIENT
                    && (s.hasUnits() || s.signalled(SignalKind.TRIGGER));
            case PERSISTENT_TRIGGER -> s.nodeLevel && n.options().trigger() == TriggerMode.PERSISTENT
                    && s.hasUnits();
            case INTERLEAVED_PARALLEL_ROUTING -> s.mutexReady(MutexKind.INTERLEAVED_PARALLEL);
            case CRITICAL_SECTION -> s.mutexReady(MutexKind.CRITICAL_SECTION);
            case INTERLEAVED_ROUTING -> s.mutexReady(MutexKind.INTERLEAVED);
            case MI_EXTEND -> s.parentLevel() && s.group.isPresent() && s.group.get().accepting()
                    && (s.signalled(SignalKind.ADD_INSTANCE) || s.signalled(SignalKind.NO_MORE_INSTANCES));
            case MI_WITHOUT_SYNCHRONIZATION -> s.readyToSpawn(CreationMode.STATIC) && !s.spec().synchronize();
            case MI_DESIGN_TIME -> s.readyToSpawn(CreationMode.STATIC);
            case MI_RUNTIME -> s.readyToSpawn(CreationMode.DYNAMIC);
            case MI_NO_PRIOR_KNOWLEDGE -> s.readyToSpawn(CreationMode.INCREMENTAL);
            case MI_CANCELLING_PARTIAL_JOIN -> s.readyToJoinInstances()
                    && s.spec().isPartial() && s.spec().cancelRemaining();
            case MI_STATIC_PARTIAL_JOIN -> s.readyToJoinInstances() && s.spec().isPartial()
                    && s.spec().creationMode() == CreationMode.STATIC;
            case MI_DYNAMIC_PARTIAL_JOIN -> s.readyToJoinInstances() && s.spec().isPartial();
            case MI_DESIGN_TIME_JOIN -> s.readyToJoinInstances() && s.spec().creationMode() == CreationMode.STATIC;
            case MI_RUNTIME_JOIN -> s.readyToJoinInstances() && s.spec().creationMode() == CreationMode.DYNAMIC;
            case MI_NO_PRIOR_KNOWLEDGE_JOIN -> s.readyToJoinInstances()
                    && s.spec().creationMode() == CreationMode.INCREMENTAL;
            case CANCEL_REGION -> s.nodeLevel && s.doneWithToken() && !n.cancellationTargets().isEmpty()
                    && !s.marking.hasMarker(n.id(), MarkerKind.REGION_CANCELLED);
            case DEFERRED_CHOICE -> s.routable() && n.options().deferred();
            case STRUCTURED_LOOP -> s.routable() && s.flowsOut.stream().anyMatch(Flow::loopBack);
            case RECURSION -> s.routable() && s.flowsOut.stream().anyMatch(Flow::isSelfLoop);
            case THREAD_SPLIT -> s.routable() && s.nodeLevel && n.options().threads() != null
                    && s.flowsOut.size() == 1;
            case PARALLEL_SPLIT -> s.routable() && n.split() == SplitType.AND && !s.flowsOut.isEmpty();
            case EXCLUSIVE_CHOICE -> s.routable() && n.split() == SplitType.XOR && !s.flowsOut.isEmpty();
            case MULTI_CHOICE -> s.routable() && n.split() == SplitType.OR && !s.flowsOut.isEmpty();
            case ARBITRARY_CYCLE -> s.singleUngatedFlow() && s.topology.isOnCycle(n.id());
            case MULTI_MERGE -> s.singleUngatedFlow()
                    && s.target().options().joinBehavior() == JoinBehavior.MULTI_MERGE;
            case SIMPLE_MERGE -> s.singleUngatedFlow() && s.target().join() == JoinType.XOR;
            case SEQUENCE -> s.singleUngatedFlow();
            case IMPLICIT_TERMINATION -> s.routable() && s.flowsOut.isEmpty();
        };
    }

    /**
     * Local shape of one subject, computed once per resolution
     */
    final class Shape {
        final Snapshot snapshot;
        final Topology topology;
        final Marking marking;
        final NodeRef ref;
        final Node node;
        final boolean nodeLevel;
        final NodeStatus status;
        final List<Flow> flowsOut;
        final Optional<MultiInstanceGroup> group;

        Shape(Snapshot snapshot, NodeRef ref) {
            this.snapshot = snapshot;
            this.topology = snapshot.topology();
            this.marking = snapshot.marking();
            this.ref = ref;
            this.node = snapshot.node(ref.nodeId());
            this.nodeLevel = !ref.isInstance();
            this.status = marking.status(ref);
            this.flowsOut = topology.flowsOut(node.id());
            this.group = node.isMultiInstance() ? marking.group(node.id()) : Optional.empty();
        }

        boolean doneWithToken() {
            return status == NodeStatus.COMPLETED && marking.hasToken(ref);
        }

        boolean signalled(SignalKind kind) {
            return marking.signal(node.id(), kind).isPresent();
        }

        boolean parentLevel() {
            return nodeLevel && node.isMultiInstance();
        }

        boolean instanceLevel() {
            return !nodeLevel && node.isMultiInstance();
        }

        MultiInstanceSpec spec() {
            return node.options().instances();
        }

        boolean spent() {
            return marking.joinState(node.id()).isPresent();
        }

        boolean hasUnits() {
            return !Arrivals.waitingAt(snapshot, node.id()).isEmpty();
        }

        /**
         * A join of the given behaviour with something to do: units to weigh or a reset to apply
         */
        boolean joinReady(JoinBehavior behavior) {
            return nodeLevel && !node.isMultiInstance()
                    && node.options().joinBehavior() == behavior
                    && (hasUnits() || signalled(SignalKind.RESET));
        }

        boolean mutexReady(MutexKind kind) {
            return nodeLevel && node.options().mutex() != null
                    && node.options().mutex().kind() == kind && hasUnits();
        }

        boolean readyToSpawn(CreationMode mode) {
            return parentLevel() && group.isEmpty() && status == NodeStatus.ACTIVE
                    && marking.hasToken(ref) && spec().creationMode() == mode;
        }

        /**
         * Synchronized group with finished instances to record, or already past its threshold
         */
        boolean readyToJoinInstances() {
            if (!parentLevel() || group.isEmpty() || status != NodeStatus.ACTIVE) {
                return false;
            }
            MultiInstanceGroup g = group.get();
            if (!g.synchronize() || g.thresholdMet()) {
                return false;
            }
            boolean finished = g.instances().stream()
                    .map(i -> NodeRef.of(node.id(), i))
                    .anyMatch(r -> marking.status(r) == NodeStatus.COMPLETED && marking.hasToken(r));
            return finished || instances.isThresholdMet(g);
        }

        /**
         * Finished work this node routes itself
         */
        boolean routable() {
            return doneWithToken() && !(node.isMultiInstance() && !nodeLevel);
        }

        boolean singleUngatedFlow() {
            return routable() && node.split() == SplitType.NONE && flowsOut.size() == 1
                    && !topology.isGated(flowsOut.get(0).target());
        }

        Node target() {
            return topology.node(flowsOut.get(0).target());
        }

        /**
         * Plain predecessor of a gated node: its finished token is the arrival
         */
        boolean waitsOnGatedTarget() {
            return flowsOut.size() == 1
                    && topology.isGated(flowsOut.get(0).target())
                    && topology.isPlainPredecessor(node.id(), flowsOut.get(0).target());
        }

        boolean isSynchronizedInstance() {
            return instanceLevel() && group.map(MultiInstanceGroup::synchronize).orElse(false);
        }
    }
}
