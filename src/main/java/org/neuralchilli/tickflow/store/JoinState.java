package org.neuralchilli.tickflow.store;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * State of a join that has fired and not yet rearmed.
 *
 * @param absorbed predecessors whose arrival has been consumed since firing
 * @param winner   predecessor that caused the firing
 */
public record JoinState(Set<String> absorbed, String winner) {

    public JoinState {
        absorbed = absorbed != null
                ? Collections.unmodifiableSet(new TreeSet<>(absorbed))
                : Set.of();
    }

    public JoinState absorb(Set<String> more) {
        Set<String> all = new TreeSet<>(absorbed);
        all.addAll(more);
        return new JoinState(all, winner);
    }

    public boolean covers(Set<String> predecessors) {
        return absorbed.containsAll(predecessors);
    }
}
