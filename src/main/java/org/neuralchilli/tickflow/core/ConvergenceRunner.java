package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.service.DivergenceException;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Repeats ticks until one changes nothing, or gives up at the tick budget.
 */
public class ConvergenceRunner {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceRunner.class);

    private final TickExecutor executor;
    private final TopologyStore store;

    public ConvergenceRunner(TickExecutor executor, TopologyStore store) {
        this.executor = executor;
        this.store = store;
    }

    /**
     * Run to the fixpoint.
     *
     * @throws DivergenceException if tick {@code maxTicks} still changed the marking
     */
    public RunResult run(int maxTicks) {
        if (maxTicks < 1) {
            throw new IllegalArgumentException("maxTicks must be positive, got: " + maxTicks);
        }
        String name = store.snapshot().topology().workflow().name();
        log.info("Running '{}' (max {} ticks)", name, maxTicks);

        List<TickResult> ticks = new ArrayList<>();
        TickResult last = null;
        for (int i = 0; i < maxTicks; i++) {
            last = executor.step();
            if (last.vetoed()) {
                log.info("Run of '{}' stopped by veto after {} ticks", name, ticks.size());
                return new RunResult(ticks, false, true, List.of());
            }
            ticks.add(last);
            if (last.converged()) {
                List<DeadlockWarning> deadlocks = deadlocks(store.snapshot());
                deadlocks.forEach(d -> log.warn("Deadlock in '{}': {}", name, d));
                log.info("Run of '{}' converged after {} ticks{}", name, ticks.size(),
                        deadlocks.isEmpty() ? "" : " with " + deadlocks.size() + " unreached output(s)");
                return new RunResult(ticks, true, false, deadlocks);
            }
        }

        log.error("Run of '{}' diverged: delta still {} after {} ticks", name, last.deltaSize(), maxTicks);
        throw new DivergenceException(ticks.size(), maxTicks, last.delta());
    }

    /**
     * Output conditions that never completed
     */
    List<DeadlockWarning> deadlocks(Snapshot snapshot) {
        List<DeadlockWarning> warnings = new ArrayList<>();
        for (Node output : snapshot.topology().workflow().outputConditions()) {
            NodeStatus status = snapshot.status(NodeRef.of(output.id()));
            if (status != NodeStatus.COMPLETED) {
                warnings.add(new DeadlockWarning(output.id(), status));
            }
        }
        return warnings;
    }
}
