package org.neuralchilli.tickflow.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Pattern-specific attributes of a node. Everything here is optional; a
 * plain task or condition uses {@link #defaults()}.
 *
 * @param manual        completes only through an explicit completion call
 * @param joinBehavior  refinement of the join (discriminator, partial join, ...)
 * @param quorum        arrivals needed by partial joins and thread merges
 * @param nestedNodes   sub-structure cancelled together with the node
 * @param instances     multi-instance declaration
 * @param milestone     node that must be ACTIVE for this node to be enabled
 * @param trigger       external trigger the node waits for
 * @param mutex         mutual-exclusion set the node belongs to
 * @param deferred      XOR split resolved by an external event instead of predicates
 * @param threads       number of threads spawned on the single outgoing flow
 * @param terminatesCase output condition that ends the whole case when reached
 */
public record NodeOptions(
        boolean manual,
        JoinBehavior joinBehavior,
        Integer quorum,
        Set<String> nestedNodes,
        MultiInstanceSpec instances,
        String milestone,
        TriggerMode trigger,
        MutexSpec mutex,
        boolean deferred,
        Integer threads,
        boolean terminatesCase
) {
    private static final NodeOptions DEFAULTS = new NodeOptions(
            false, JoinBehavior.STANDARD, null, Set.of(), null, null, TriggerMode.NONE, null, false, null, false
    );

    public NodeOptions {
        if (joinBehavior == null) {
            joinBehavior = JoinBehavior.STANDARD;
        }
        if (trigger == null) {
            trigger = TriggerMode.NONE;
        }
        nestedNodes = nestedNodes != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(nestedNodes))
                : Set.of();

        if (quorum != null && quorum < 1) {
            throw new IllegalArgumentException("Quorum must be at least 1, got: " + quorum);
        }
        if (threads != null && threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got: " + threads);
        }
        if (joinBehavior.needsQuorum() && quorum == null) {
            throw new IllegalArgumentException(
                    "Join behaviour " + joinBehavior + " needs a quorum"
            );
        }
        if (milestone != null && milestone.isBlank()) {
            milestone = null;
        }
    }

    public static NodeOptions defaults() {
        return DEFAULTS;
    }

    public boolean isMultiInstance() {
        return instances != null;
    }
}
