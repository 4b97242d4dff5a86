package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.store.Delta;

import java.util.List;

/**
 * Result of merging one tick's contributions.
 *
 * @param delta    the combined change set to commit
 * @param accepted contributions folded into {@code delta}
 * @param deferred contributions left out this tick; their subjects retry next tick
 */
public record MergeOutcome(
        Delta delta,
        List<Contribution> accepted,
        List<Contribution> deferred,
        List<Diagnostic> diagnostics
) {
    public MergeOutcome {
        delta = delta != null ? delta : Delta.EMPTY;
        accepted = accepted != null ? List.copyOf(accepted) : List.of();
        deferred = deferred != null ? List.copyOf(deferred) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }
}
