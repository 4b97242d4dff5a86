package org.neuralchilli.tickflow.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A task or condition of a workflow net.
 * Status is not part of the node; it lives in the marking.
 *
 * @param cancellationTargets node ids, or {@code "source->target"} flow keys,
 *                            cleared when this node cancels its region
 */
public record Node(
        String id,
        NodeKind kind,
        SplitType split,
        JoinType join,
        Set<String> cancellationTargets,
        NodeOptions options
) {
    public Node {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }

        if (!id.matches("^[A-Za-z0-9_-]+$")) {
            throw new IllegalArgumentException(
                    "Node id must match pattern ^[A-Za-z0-9_-]+$, got: " + id
            );
        }

        // Defaults
        if (kind == null) {
            kind = NodeKind.TASK;
        }
        if (split == null) {
            split = SplitType.NONE;
        }
        if (join == null) {
            join = JoinType.NONE;
        }
        if (options == null) {
            options = NodeOptions.defaults();
        }
        cancellationTargets = cancellationTargets != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(cancellationTargets))
                : Set.of();

        if (options.isMultiInstance() && kind != NodeKind.TASK) {
            throw new IllegalArgumentException("Only tasks can be multi-instance: " + id);
        }
        if (options.terminatesCase() && kind != NodeKind.OUTPUT_CONDITION) {
            throw new IllegalArgumentException(
                    "Only an output condition can terminate the case: " + id
            );
        }
    }

    public static Node task(String id) {
        return builder(id).build();
    }

    public static Node condition(String id) {
        return builder(id).kind(NodeKind.CONDITION).build();
    }

    /**
     * Check if manual completion is required. Conditions never wait.
     */
    public boolean isManual() {
        return options.manual() && !kind.isCondition();
    }

    public boolean isMultiInstance() {
        return options.isMultiInstance();
    }

    /**
     * Builder for creating nodes fluently
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private NodeKind kind = NodeKind.TASK;
        private SplitType split = SplitType.NONE;
        private JoinType join = JoinType.NONE;
        private Set<String> cancellationTargets = new LinkedHashSet<>();
        private boolean manual;
        private JoinBehavior joinBehavior = JoinBehavior.STANDARD;
        private Integer quorum;
        private Set<String> nestedNodes = new LinkedHashSet<>();
        private MultiInstanceSpec instances;
        private String milestone;
        private TriggerMode trigger = TriggerMode.NONE;
        private MutexSpec mutex;
        private boolean deferred;
        private Integer threads;
        private boolean terminatesCase;

        public Builder(String id) {
            this.id = id;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder split(SplitType split) {
            this.split = split;
            return this;
        }

        public Builder join(JoinType join) {
            this.join = join;
            return this;
        }

        public Builder cancels(String... targets) {
            this.cancellationTargets.addAll(List.of(targets));
            return this;
        }

        public Builder cancellationTargets(Set<String> targets) {
            this.cancellationTargets = new LinkedHashSet<>(targets);
            return this;
        }

        public Builder manual(boolean manual) {
            this.manual = manual;
            return this;
        }

        public Builder joinBehavior(JoinBehavior joinBehavior) {
            this.joinBehavior = joinBehavior;
            return this;
        }

        public Builder quorum(Integer quorum) {
            this.quorum = quorum;
            return this;
        }

        public Builder nested(String... nodeIds) {
            this.nestedNodes.addAll(List.of(nodeIds));
            return this;
        }

        public Builder nestedNodes(Set<String> nestedNodes) {
            this.nestedNodes = new LinkedHashSet<>(nestedNodes);
            return this;
        }

        public Builder instances(MultiInstanceSpec instances) {
            this.instances = instances;
            return this;
        }

        public Builder milestone(String milestone) {
            this.milestone = milestone;
            return this;
        }

        public Builder trigger(TriggerMode trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder mutex(MutexSpec mutex) {
            this.mutex = mutex;
            return this;
        }

        public Builder deferred(boolean deferred) {
            this.deferred = deferred;
            return this;
        }

        public Builder threads(Integer threads) {
            this.threads = threads;
            return this;
        }

        public Builder terminatesCase(boolean terminatesCase) {
            this.terminatesCase = terminatesCase;
            return this;
        }

        public Node build() {
            NodeOptions options = new NodeOptions(
                    manual, joinBehavior, quorum, nestedNodes, instances,
                    milestone, trigger, mutex, deferred, threads, terminatesCase
            );
            return new Node(id, kind, split, join, cancellationTargets, options);
        }
    }
}
