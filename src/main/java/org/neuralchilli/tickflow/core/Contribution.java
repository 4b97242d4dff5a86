package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.catalog.PatternMapping;
import org.neuralchilli.tickflow.catalog.Verb;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Fact;

import javax.annotation.Nonnull;
import java.util.Set;
import java.util.TreeSet;

/**
 * One subject's share of a tick: the delta a verb (or the completion sweep)
 * computed for it against the tick's snapshot.
 *
 * @param mapping the pattern that fired, null for work completion
 */
public record Contribution(NodeRef subject, PatternMapping mapping, Delta delta) {

    public static final String COMPLETION = "completion";

    public Contribution {
        if (subject == null) {
            throw new IllegalArgumentException("Contribution needs a subject");
        }
        delta = delta != null ? delta : Delta.EMPTY;
    }

    public static Contribution completion(NodeRef subject, Delta delta) {
        return new Contribution(subject, null, delta);
    }

    public boolean isCompletion() {
        return mapping == null;
    }

    public boolean isCancellation() {
        return mapping != null && mapping.verb() == Verb.VOID;
    }

    public String label() {
        return mapping != null ? mapping.name() : COMPLETION;
    }

    /**
     * Slots this contribution reads and rewrites
     */
    public Set<String> claims() {
        Set<String> keys = new TreeSet<>();
        delta.removals().forEach(f -> keys.add(f.key()));
        delta.additions().stream().map(Fact::key).forEach(keys::add);
        return keys;
    }

    @Nonnull
    @Override
    public String toString() {
        return label() + "@" + subject + " (" + delta.size() + " changes)";
    }
}
