package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.CreationMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Instance set of a multi-instance task. Instances are addressed by integer
 * id as {@code (parentNode, id)}; the group only owns the ids.
 *
 * @param instances    instance ids in creation order
 * @param completed    instance ids whose completion has been recorded
 * @param accepting    an incremental group still taking new instances
 * @param thresholdMet the parent has already continued
 */
public record MultiInstanceGroup(
        String parentNode,
        List<Integer> instances,
        Set<Integer> completed,
        int min,
        int max,
        Integer threshold,
        CreationMode creationMode,
        boolean accepting,
        boolean synchronize,
        boolean thresholdMet
) {
    public MultiInstanceGroup {
        if (parentNode == null || parentNode.isBlank()) {
            throw new IllegalArgumentException("Group parent cannot be null or empty");
        }
        instances = instances != null ? List.copyOf(instances) : List.of();
        completed = completed != null
                ? Collections.unmodifiableSet(new TreeSet<>(completed))
                : Set.of();
        if (creationMode == null) {
            creationMode = CreationMode.STATIC;
        }
        if (instances.size() > max) {
            throw new IllegalArgumentException(
                    "Group " + parentNode + " has " + instances.size() + " instances, max is " + max
            );
        }
        if (!instances.containsAll(completed)) {
            throw new IllegalArgumentException("Group " + parentNode + " records unknown completions");
        }
    }

    public int size() {
        return instances.size();
    }

    public int completedCount() {
        return completed.size();
    }

    public int nextInstanceId() {
        return instances.isEmpty() ? 0 : Collections.max(instances) + 1;
    }

    public boolean contains(int instance) {
        return instances.contains(instance);
    }

    MultiInstanceGroup withInstances(List<Integer> newInstances) {
        return new MultiInstanceGroup(parentNode, newInstances, completed, min, max, threshold,
                creationMode, accepting, synchronize, thresholdMet);
    }

    public MultiInstanceGroup withInstanceAdded() {
        List<Integer> next = new ArrayList<>(instances);
        next.add(nextInstanceId());
        return withInstances(next);
    }

    public MultiInstanceGroup withCompleted(Set<Integer> instanceIds) {
        Set<Integer> next = new TreeSet<>(completed);
        next.addAll(instanceIds);
        return new MultiInstanceGroup(parentNode, instances, next, min, max, threshold,
                creationMode, accepting, synchronize, thresholdMet);
    }

    public MultiInstanceGroup withAccepting(boolean value) {
        return new MultiInstanceGroup(parentNode, instances, completed, min, max, threshold,
                creationMode, value, synchronize, thresholdMet);
    }

    public MultiInstanceGroup withThresholdMet() {
        return new MultiInstanceGroup(parentNode, instances, completed, min, max, threshold,
                creationMode, accepting, synchronize, true);
    }
}
