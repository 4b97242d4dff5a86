package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.store.Delta;

import java.util.List;

/**
 * Outcome of one tick.
 *
 * @param deltaSize additions plus removals committed
 * @param converged the tick changed nothing
 * @param vetoed    a listener stopped the tick before it ran
 * @param firings   labels of the contributions committed, in merge order
 */
public record TickResult(
        long tickNumber,
        int deltaSize,
        boolean converged,
        boolean vetoed,
        Delta delta,
        List<Diagnostic> diagnostics,
        List<String> firings
) {
    public TickResult {
        delta = delta != null ? delta : Delta.EMPTY;
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        firings = firings != null ? List.copyOf(firings) : List.of();
    }

    public static TickResult vetoed(long tickNumber) {
        return new TickResult(tickNumber, 0, false, true, Delta.EMPTY, List.of(), List.of());
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
