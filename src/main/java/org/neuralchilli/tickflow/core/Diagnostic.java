package org.neuralchilli.tickflow.core;

import javax.annotation.Nonnull;

/**
 * Non-fatal report tied to the node it concerns.
 */
public record Diagnostic(DiagnosticKind kind, String nodeId, String message) {

    public Diagnostic {
        if (kind == null) {
            throw new IllegalArgumentException("Diagnostic kind cannot be null");
        }
        message = message != null ? message : "";
    }

    @Nonnull
    @Override
    public String toString() {
        return kind + "[" + nodeId + "]: " + message;
    }
}
