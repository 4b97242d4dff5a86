package org.neuralchilli.tickflow.monitoring;

/**
 * What one tick did.
 *
 * @param patternsFired contributions committed in the tick
 * @param durationNanos wall time between pre- and post-tick hooks
 */
public record ProvenanceRecord(long tickNumber, int patternsFired, int deltaSize, long durationNanos) {
}
