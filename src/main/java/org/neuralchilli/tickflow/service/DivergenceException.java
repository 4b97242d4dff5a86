package org.neuralchilli.tickflow.service;

import org.neuralchilli.tickflow.store.Delta;

/**
 * The run did not reach a fixpoint within its tick budget. Fatal to the run.
 */
public class DivergenceException extends WorkflowEngineException {

    private final int tickCount;
    private final int maxTicks;
    private final transient Delta lastDelta;

    public DivergenceException(int tickCount, int maxTicks, Delta lastDelta) {
        super(String.format(
                "No convergence after %d ticks (max %d); last delta had %d changes",
                tickCount, maxTicks, lastDelta != null ? lastDelta.size() : 0
        ));
        this.tickCount = tickCount;
        this.maxTicks = maxTicks;
        this.lastDelta = lastDelta != null ? lastDelta : Delta.EMPTY;
    }

    public int getTickCount() {
        return tickCount;
    }

    public int getMaxTicks() {
        return maxTicks;
    }

    public Delta getLastDelta() {
        return lastDelta;
    }
}
