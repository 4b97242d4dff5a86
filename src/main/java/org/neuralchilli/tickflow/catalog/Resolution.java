package org.neuralchilli.tickflow.catalog;

import org.neuralchilli.tickflow.domain.NodeRef;

/**
 * A resolved activation: which pattern handles the subject this tick.
 */
public record Resolution(NodeRef subject, PatternMapping mapping) {

    public Verb verb() {
        return mapping.verb();
    }

    public VerbParameters parameters() {
        return mapping.parameters();
    }
}
