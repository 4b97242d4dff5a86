package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.catalog.PatternResolver;
import org.neuralchilli.tickflow.catalog.Resolution;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.kernel.Kernel;
import org.neuralchilli.tickflow.service.AmbiguousPatternException;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs one round: collect resolvable subjects, evaluate every verb against
 * the same snapshot, merge, commit atomically and measure.
 */
public class TickExecutor {

    private static final Logger log = LoggerFactory.getLogger(TickExecutor.class);

    private final TopologyStore store;
    private final PatternResolver resolver;
    private final Kernel kernel;
    private final DeltaMerger merger;
    private final CompletionSweep sweep;
    private final List<TickListener> listeners = new CopyOnWriteArrayList<>();

    private long tickCount;

    public TickExecutor(TopologyStore store, PatternResolver resolver, Kernel kernel) {
        this(store, resolver, kernel, new DeltaMerger(), new CompletionSweep());
    }

    public TickExecutor(
            TopologyStore store,
            PatternResolver resolver,
            Kernel kernel,
            DeltaMerger merger,
            CompletionSweep sweep
    ) {
        this.store = store;
        this.resolver = resolver;
        this.kernel = kernel;
        this.merger = merger;
        this.sweep = sweep;
    }

    public void addListener(TickListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TickListener listener) {
        listeners.remove(listener);
    }

    public List<TickListener> listeners() {
        return List.copyOf(listeners);
    }

    public long tickCount() {
        return tickCount;
    }

    /**
     * Execute one tick.
     *
     * @throws StructuralException if the merged delta cannot be committed; the engine halts
     */
    public TickResult step() {
        long tickNumber = tickCount + 1;
        Snapshot snapshot = store.snapshot();

        for (TickListener listener : listeners) {
            if (!listener.onPreTick(tickNumber, snapshot)) {
                log.info("Tick {} vetoed by {}", tickNumber, listener.getClass().getSimpleName());
                return TickResult.vetoed(tickNumber);
            }
        }
        tickCount = tickNumber;

        // Collect and evaluate
        List<Contribution> contributions = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (NodeRef subject : subjects(snapshot)) {
            evaluate(snapshot, subject, diagnostics).ifPresent(contributions::add);
        }
        contributions.addAll(sweep.sweep(snapshot));

        // Merge, apply, measure
        MergeOutcome outcome = merger.merge(snapshot, contributions);
        diagnostics.addAll(outcome.diagnostics());
        Delta delta = outcome.delta();
        Snapshot after = store.apply(delta);

        List<String> firings = new ArrayList<>();
        for (Contribution contribution : outcome.accepted()) {
            firings.add(contribution.label() + "@" + contribution.subject());
            for (TickListener listener : listeners) {
                listener.onPatternFired(tickNumber, contribution);
            }
        }

        TickResult result = new TickResult(tickNumber, delta.size(), delta.isEmpty(), false,
                delta, diagnostics, firings);
        log.debug("Tick {}: {} contributions, {} accepted, {} deferred, delta {}",
                tickNumber, contributions.size(), outcome.accepted().size(),
                outcome.deferred().size(), delta.size());

        for (TickListener listener : listeners) {
            listener.onPostTick(result, after);
        }
        return result;
    }

    /**
     * Every node, plus every instance the marking knows about, in a stable order
     */
    Set<NodeRef> subjects(Snapshot snapshot) {
        Set<NodeRef> subjects = new TreeSet<>(NodeRef.ORDER);
        for (Node node : snapshot.topology().nodes()) {
            subjects.add(NodeRef.of(node.id()));
        }
        subjects.addAll(snapshot.marking().statuses().keySet());
        subjects.addAll(snapshot.marking().tokenRefs());
        return subjects;
    }

    /**
     * Resolve and run one subject. Per-node failures become diagnostics and the node sits this tick out.
     */
    private Optional<Contribution> evaluate(Snapshot snapshot, NodeRef subject, List<Diagnostic> diagnostics) {
        Optional<Resolution> resolution;
        try {
            resolution = resolver.resolve(snapshot, subject);
        } catch (AmbiguousPatternException e) {
            log.warn("Node {} is inert: {}", subject, e.getMessage());
            diagnostics.add(new Diagnostic(DiagnosticKind.AMBIGUOUS_PATTERN, subject.nodeId(), e.getMessage()));
            return Optional.empty();
        }
        if (resolution.isEmpty()) {
            return Optional.empty();
        }

        try {
            Delta delta = kernel.execute(snapshot, resolution.get());
            return Optional.of(new Contribution(subject, resolution.get().mapping(), delta));
        } catch (AmbiguousPatternException e) {
            log.warn("Node {} is inert under {}: {}", subject, resolution.get().mapping().name(), e.getMessage());
            diagnostics.add(new Diagnostic(DiagnosticKind.AMBIGUOUS_PATTERN, subject.nodeId(), e.getMessage()));
            return Optional.empty();
        } catch (StructuralException e) {
            log.warn("Skipping {} for {}: {}", resolution.get().mapping().name(), subject, e.getMessage());
            String nodeId = e.getNodeId() != null ? e.getNodeId() : subject.nodeId();
            diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL, nodeId, e.getMessage()));
            return Optional.empty();
        }
    }
}
