package org.neuralchilli.tickflow.kernel;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.tickflow.catalog.Cardinality;
import org.neuralchilli.tickflow.domain.CreationMode;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Arithmetic over multi-instance groups. Groups themselves live in the
 * marking as {@link GroupFact}s, keyed by parent node; this class only
 * computes their next state, so Copy, Await and Void stay pure.
 */
@ApplicationScoped
public class MultiInstanceManager {

    private static final Logger log = LoggerFactory.getLogger(MultiInstanceManager.class);

    /**
     * Open a group for {@code parent}. The group id is the parent node id.
     *
     * @param countHint instance count evaluated at runtime, used by dynamic cardinality
     */
    public MultiInstanceGroup openGroup(String parent, MultiInstanceSpec spec, Cardinality cardinality, int countHint) {
        int count = switch (cardinality) {
            case STATIC -> spec.min();
            case DYNAMIC -> Math.max(spec.min(), Math.min(spec.max(), countHint));
            case INCREMENTAL -> 1;
            case TOPOLOGY -> throw new IllegalArgumentException(
                    "Topology cardinality does not open a group: " + parent);
        };

        List<Integer> instances = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            instances.add(i);
        }

        CreationMode mode = switch (cardinality) {
            case DYNAMIC -> CreationMode.DYNAMIC;
            case INCREMENTAL -> CreationMode.INCREMENTAL;
            default -> CreationMode.STATIC;
        };

        MultiInstanceGroup group = new MultiInstanceGroup(
                parent,
                instances,
                Set.of(),
                spec.min(),
                spec.max(),
                spec.threshold(),
                mode,
                cardinality == Cardinality.INCREMENTAL,
                spec.synchronize(),
                !spec.synchronize()
        );
        log.debug("Opened group {} with {} instances ({})", parent, count, mode);
        return group;
    }

    /**
     * Add one instance to an incremental group
     *
     * @throws IllegalStateException if the group is closed to new instances or full
     */
    public MultiInstanceGroup extend(MultiInstanceGroup group) {
        if (!group.accepting()) {
            throw new IllegalStateException("Group " + group.parentNode() + " no longer accepts instances");
        }
        if (group.size() >= group.max()) {
            throw new IllegalStateException(
                    "Group " + group.parentNode() + " is already at its maximum of " + group.max()
            );
        }
        return group.withInstanceAdded();
    }

    /**
     * Stop accepting new instances (the "no more instances" signal)
     */
    public MultiInstanceGroup stopAccepting(MultiInstanceGroup group) {
        return group.withAccepting(false);
    }

    public MultiInstanceGroup recordCompletion(MultiInstanceGroup group, Set<Integer> instances) {
        for (Integer instance : instances) {
            if (!group.contains(instance)) {
                throw new IllegalArgumentException(
                        "Instance " + instance + " does not belong to group " + group.parentNode()
                );
            }
        }
        return group.withCompleted(instances);
    }

    /**
     * Check if enough instances have completed for the parent to continue.
     *
     * @param threshold quorum, or null to require every instance
     */
    public boolean isThresholdMet(MultiInstanceGroup group, Integer threshold) {
        if (threshold != null) {
            return group.completedCount() >= threshold;
        }
        return !group.accepting() && group.completedCount() >= group.size();
    }

    public boolean isThresholdMet(MultiInstanceGroup group) {
        return isThresholdMet(group, group.threshold());
    }

    /**
     * Instances that are neither completed nor voided
     */
    public List<NodeRef> unfinished(Snapshot snapshot, MultiInstanceGroup group) {
        List<NodeRef> result = new ArrayList<>();
        for (Integer instance : group.instances()) {
            NodeRef ref = NodeRef.of(group.parentNode(), instance);
            if (!snapshot.status(ref).isTerminal()) {
                result.add(ref);
            }
        }
        return result;
    }

    /**
     * Every instance is terminal and holds no token
     */
    public boolean isSettled(Snapshot snapshot, MultiInstanceGroup group) {
        for (Integer instance : group.instances()) {
            NodeRef ref = NodeRef.of(group.parentNode(), instance);
            NodeStatus status = snapshot.status(ref);
            if (!status.isTerminal() || snapshot.hasToken(ref)) {
                return false;
            }
        }
        return true;
    }

    /**
     * The fact to retract when a group is destroyed
     *
     * @throws IllegalStateException while an incremental group still accepts instances
     */
    public GroupFact closeGroup(MultiInstanceGroup group) {
        if (group.accepting()) {
            throw new IllegalStateException(
                    "Group " + group.parentNode() + " cannot close while it still accepts instances"
            );
        }
        log.debug("Closing group {} ({}/{} completed)",
                group.parentNode(), group.completedCount(), group.size());
        return new GroupFact(group);
    }
}
