package org.neuralchilli.tickflow.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.tickflow.catalog.Verb;
import org.neuralchilli.tickflow.core.Contribution;
import org.neuralchilli.tickflow.core.Diagnostic;
import org.neuralchilli.tickflow.core.DiagnosticKind;
import org.neuralchilli.tickflow.core.TickListener;
import org.neuralchilli.tickflow.core.TickResult;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Engine-wide counters, shared by every engine the factory creates.
 *
 * Tracks:
 * - ticks executed and vetoed
 * - verb executions (completions counted separately)
 * - committed changes
 * - diagnostics by kind
 */
@ApplicationScoped
public class EngineMetrics implements TickListener {

    private static final Logger log = LoggerFactory.getLogger(EngineMetrics.class);

    private final LongAdder ticks = new LongAdder();
    private final LongAdder convergedTicks = new LongAdder();
    private final LongAdder completions = new LongAdder();
    private final LongAdder changes = new LongAdder();
    private final Map<Verb, LongAdder> verbs = new EnumMap<>(Verb.class);
    private final Map<DiagnosticKind, LongAdder> diagnostics = new EnumMap<>(DiagnosticKind.class);

    public EngineMetrics() {
        for (Verb verb : Verb.values()) {
            verbs.put(verb, new LongAdder());
        }
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            diagnostics.put(kind, new LongAdder());
        }
    }

    @Override
    public void onPatternFired(long tickNumber, Contribution contribution) {
        if (contribution.isCompletion()) {
            completions.increment();
        } else {
            verbs.get(contribution.mapping().verb()).increment();
        }
    }

    @Override
    public void onPostTick(TickResult result, Snapshot after) {
        ticks.increment();
        if (result.converged()) {
            convergedTicks.increment();
        }
        changes.add(result.deltaSize());
        for (Diagnostic diagnostic : result.diagnostics()) {
            diagnostics.get(diagnostic.kind()).increment();
        }
    }

    public long getTicks() {
        return ticks.sum();
    }

    public long getConvergedTicks() {
        return convergedTicks.sum();
    }

    public long getCompletions() {
        return completions.sum();
    }

    public long getVerbCount(Verb verb) {
        return verbs.get(verb).sum();
    }

    public long getDiagnosticCount(DiagnosticKind kind) {
        return diagnostics.get(kind).sum();
    }

    /**
     * Races resolved in favour of a cancellation
     */
    public long getConflicts() {
        return getDiagnosticCount(DiagnosticKind.CANCELLATION_CONFLICT);
    }

    /**
     * Get average committed changes per tick.
     */
    public double getAverageDeltaSize() {
        long count = ticks.sum();
        return count > 0 ? (double) changes.sum() / count : 0.0;
    }

    /**
     * Log a summary of all metrics.
     */
    public void logSummary() {
        log.info("=== Engine Metrics ===");
        log.info("Ticks: {} ({} converged), avg delta {}",
                getTicks(), getConvergedTicks(), String.format("%.2f", getAverageDeltaSize()));
        log.info("Verbs: transmute={}, copy={}, filter={}, await={}, void={}, completions={}",
                getVerbCount(Verb.TRANSMUTE), getVerbCount(Verb.COPY), getVerbCount(Verb.FILTER),
                getVerbCount(Verb.AWAIT), getVerbCount(Verb.VOID), getCompletions());
        log.info("Diagnostics: structural={}, ambiguous={}, cancellation-conflicts={}, contested={}",
                getDiagnosticCount(DiagnosticKind.STRUCTURAL),
                getDiagnosticCount(DiagnosticKind.AMBIGUOUS_PATTERN),
                getConflicts(),
                getDiagnosticCount(DiagnosticKind.CONTESTED_CONSUMPTION));
    }

    /**
     * Reset all metrics.
     */
    public void reset() {
        ticks.reset();
        convergedTicks.reset();
        completions.reset();
        changes.reset();
        verbs.values().forEach(LongAdder::reset);
        diagnostics.values().forEach(LongAdder::reset);
    }
}
