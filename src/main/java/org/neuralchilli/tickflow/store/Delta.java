package org.neuralchilli.tickflow.store;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable change set: facts to add and facts to remove. Produced by one
 * verb call, or by merging the contributions of one tick.
 */
public record Delta(Set<Fact> additions, Set<Fact> removals) {

    public static final Delta EMPTY = new Delta(Set.of(), Set.of());

    public Delta {
        additions = additions != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(additions))
                : Set.of();
        removals = removals != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(removals))
                : Set.of();
    }

    /**
     * Number of effective changes
     */
    public int size() {
        return additions.size() + removals.size();
    }

    public boolean isEmpty() {
        return additions.isEmpty() && removals.isEmpty();
    }

    /**
     * Union of several deltas. A fact both added and removed is removed:
     * cancellation overrides a concurrent activation.
     */
    public static Delta union(Collection<Delta> deltas) {
        Set<Fact> added = new LinkedHashSet<>();
        Set<Fact> removed = new LinkedHashSet<>();
        for (Delta delta : deltas) {
            added.addAll(delta.additions());
            removed.addAll(delta.removals());
        }
        added.removeAll(removed);
        return new Delta(added, removed);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates changes, netting out a fact that is added and removed by
     * the same producer (e.g. a token routed back onto its own node).
     */
    public static class Builder {
        private final Set<Fact> additions = new LinkedHashSet<>();
        private final Set<Fact> removals = new LinkedHashSet<>();

        public Builder add(Fact fact) {
            if (!removals.remove(fact)) {
                additions.add(fact);
            }
            return this;
        }

        public Builder remove(Fact fact) {
            if (!additions.remove(fact)) {
                removals.add(fact);
            }
            return this;
        }

        public Builder removeAll(Collection<? extends Fact> facts) {
            facts.forEach(this::remove);
            return this;
        }

        public boolean isEmpty() {
            return additions.isEmpty() && removals.isEmpty();
        }

        public Delta build() {
            return new Delta(additions, removals);
        }
    }
}
