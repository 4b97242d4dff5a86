package org.neuralchilli.tickflow.core;

import java.util.List;
import java.util.stream.Stream;

/**
 * Outcome of running a case to its fixpoint.
 *
 * @param ticks    every tick executed, the converging one last
 * @param vetoed   a listener stopped the run before it converged
 */
public record RunResult(
        List<TickResult> ticks,
        boolean converged,
        boolean vetoed,
        List<DeadlockWarning> deadlocks
) {
    public RunResult {
        ticks = ticks != null ? List.copyOf(ticks) : List.of();
        deadlocks = deadlocks != null ? List.copyOf(deadlocks) : List.of();
    }

    public int tickCount() {
        return ticks.size();
    }

    public boolean isDeadlocked() {
        return !deadlocks.isEmpty();
    }

    /**
     * Converged with every output condition reached
     */
    public boolean isSuccessful() {
        return converged && deadlocks.isEmpty();
    }

    /**
     * Diagnostics of every tick, followed by one DEADLOCK entry per unreached output
     */
    public List<Diagnostic> diagnostics() {
        return Stream.concat(
                ticks.stream().flatMap(t -> t.diagnostics().stream()),
                deadlocks.stream().map(d -> new Diagnostic(DiagnosticKind.DEADLOCK, d.nodeId(), d.toString()))
        ).toList();
    }
}
