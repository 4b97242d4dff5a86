package org.neuralchilli.tickflow.catalog;

import javax.annotation.Nonnull;

/**
 * Immutable catalog entry: a trigger shape mapped to a verb and its
 * parameters.
 *
 * @param wcp number of the workflow control pattern the entry implements (1..43)
 */
public record PatternMapping(
        int wcp,
        String name,
        Trigger trigger,
        VerbParameters parameters
) {
    public PatternMapping {
        if (wcp < 1 || wcp > 43) {
            throw new IllegalArgumentException("WCP number must be within 1..43, got: " + wcp);
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pattern name cannot be null or empty");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("Pattern " + name + " needs a trigger");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("Pattern " + name + " needs verb parameters");
        }
    }

    public Verb verb() {
        return parameters.verb();
    }

    @Nonnull
    @Override
    public String toString() {
        return "WCP-" + wcp + " " + name + " (" + verb() + ")";
    }
}
