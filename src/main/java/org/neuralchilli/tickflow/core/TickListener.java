package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.store.Snapshot;

/**
 * Hooks around a tick. Listeners observe; only {@link #onPreTick} can
 * influence the run, by vetoing the tick.
 */
public interface TickListener {

    /**
     * Called before the tick resolves anything
     *
     * @return false to veto the tick
     */
    default boolean onPreTick(long tickNumber, Snapshot snapshot) {
        return true;
    }

    /**
     * Called once per contribution that made it into the committed delta
     */
    default void onPatternFired(long tickNumber, Contribution contribution) {
    }

    default void onPostTick(TickResult result, Snapshot after) {
    }
}
