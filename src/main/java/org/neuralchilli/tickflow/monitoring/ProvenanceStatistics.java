package org.neuralchilli.tickflow.monitoring;

/**
 * Aggregates over a recorder's history.
 *
 * @param mostFiredPattern null when nothing fired
 */
public record ProvenanceStatistics(
        int totalTicks,
        long totalPatternsFired,
        double averagePatternsPerTick,
        double averageDeltaSize,
        String mostFiredPattern,
        long mostFiredCount
) {
    public static final ProvenanceStatistics EMPTY = new ProvenanceStatistics(0, 0, 0.0, 0.0, null, 0);
}
