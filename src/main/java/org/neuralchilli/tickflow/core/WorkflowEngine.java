package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.catalog.PatternCatalog;
import org.neuralchilli.tickflow.catalog.PatternResolver;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.kernel.DeltaWriter;
import org.neuralchilli.tickflow.kernel.Kernel;
import org.neuralchilli.tickflow.kernel.MultiInstanceManager;
import org.neuralchilli.tickflow.service.DivergenceException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * One case of one workflow. Single writer: ingress calls (load, start,
 * complete, signal) and ticks all run on the caller's thread, never during
 * a tick.
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final TopologyStore store = new TopologyStore();
    private final PatternCatalog catalog;
    private final TickExecutor executor;
    private final ConvergenceRunner runner;
    private final int defaultMaxTicks;

    public WorkflowEngine(
            PatternCatalog catalog,
            MultiInstanceManager instances,
            ExpressionEvaluator evaluator,
            ReachabilityService reachability,
            int defaultMaxTicks
    ) {
        this.catalog = catalog;
        this.executor = new TickExecutor(
                store,
                new PatternResolver(catalog, instances),
                new Kernel(instances, evaluator, reachability)
        );
        this.runner = new ConvergenceRunner(executor, store);
        this.defaultMaxTicks = defaultMaxTicks;
    }

    // Ingress

    /**
     * Replace structure and marking, e.g. from a previous {@link #snapshotExport()}
     */
    public void loadTopology(GraphFacts facts) {
        store.load(facts);
        log.info("Loaded workflow '{}' ({} nodes, {} facts)",
                facts.workflow().name(), facts.workflow().nodes().size(), facts.facts().size());
    }

    public void load(Workflow workflow) {
        loadTopology(GraphFacts.of(workflow));
    }

    /**
     * Put the first token on the input condition
     *
     * @throws IllegalStateException if the workflow has no input condition or already started
     */
    public void start() {
        Snapshot snapshot = store.snapshot();
        Node input = snapshot.topology().workflow().inputCondition()
                .orElseThrow(() -> new IllegalStateException(
                        "Workflow '" + workflow().name() + "' has no input condition"));
        NodeRef ref = NodeRef.of(input.id());
        if (snapshot.status(ref) != NodeStatus.PENDING) {
            throw new IllegalStateException("Case of '" + workflow().name() + "' already started");
        }
        store.apply(new DeltaWriter(snapshot).activate(ref).build());
        log.info("Started case of '{}' at {}", workflow().name(), input.id());
    }

    public void complete(String nodeId) {
        complete(NodeRef.of(nodeId));
    }

    public void complete(String nodeId, int instance) {
        complete(NodeRef.of(nodeId, instance));
    }

    /**
     * Finish the work of an active ref, typically a manual task
     *
     * @throws IllegalStateException if the ref is not active
     */
    public void complete(NodeRef ref) {
        Snapshot snapshot = store.snapshot();
        requireNode(snapshot, ref.nodeId());
        NodeStatus status = snapshot.status(ref);
        if (status != NodeStatus.ACTIVE) {
            throw new IllegalStateException("Cannot complete " + ref + " in status " + status);
        }
        store.apply(CompletionSweep.complete(snapshot, ref));
        log.debug("Completed {}", ref);
    }

    public void signal(String nodeId, SignalKind kind) {
        signal(nodeId, kind, null);
    }

    /**
     * Deliver an external signal. Repeating a signal that has not been consumed yet is a no-op.
     */
    public void signal(String nodeId, SignalKind kind, String argument) {
        Snapshot snapshot = store.snapshot();
        requireNode(snapshot, nodeId);
        SignalFact signal = new SignalFact(nodeId, kind, argument, snapshot.generation());
        if (snapshot.marking().bySlot(signal.key()).isPresent()) {
            log.debug("Signal {} already pending", signal);
            return;
        }
        store.apply(Delta.builder().add(signal).build());
        log.debug("Signal {} delivered to {}", kind, nodeId);
    }

    // Tick control

    public TickResult step() {
        return executor.step();
    }

    public RunResult runToCompletion() {
        return runToCompletion(defaultMaxTicks);
    }

    /**
     * @throws DivergenceException if the case is still changing after {@code maxTicks}
     */
    public RunResult runToCompletion(int maxTicks) {
        return runner.run(maxTicks);
    }

    // Inspection

    public NodeStatus statusOf(String nodeId) {
        return statusOf(NodeRef.of(nodeId));
    }

    public NodeStatus statusOf(NodeRef ref) {
        Snapshot snapshot = store.snapshot();
        requireNode(snapshot, ref.nodeId());
        return snapshot.status(ref);
    }

    public boolean hasToken(NodeRef ref) {
        return store.snapshot().hasToken(ref);
    }

    public Snapshot snapshot() {
        return store.snapshot();
    }

    public GraphFacts snapshotExport() {
        return store.export();
    }

    public Workflow workflow() {
        return store.snapshot().topology().workflow();
    }

    public PatternCatalog catalog() {
        return catalog;
    }

    public long tickCount() {
        return executor.tickCount();
    }

    public void addListener(TickListener listener) {
        executor.addListener(listener);
    }

    public void removeListener(TickListener listener) {
        executor.removeListener(listener);
    }

    /**
     * First attached listener of the given type, e.g. a provenance recorder
     */
    public <T extends TickListener> Optional<T> listener(Class<T> type) {
        return executor.listeners().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    private void requireNode(Snapshot snapshot, String nodeId) {
        if (!snapshot.topology().hasNode(nodeId)) {
            throw new IllegalArgumentException(
                    "Unknown node '" + nodeId + "' in workflow '" + snapshot.topology().workflow().name() + "'");
        }
    }
}
