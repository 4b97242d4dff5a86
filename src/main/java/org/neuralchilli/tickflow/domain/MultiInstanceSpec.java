package org.neuralchilli.tickflow.domain;

/**
 * Multi-instance declaration of a task.
 *
 * @param min             instances created up front (static) and lower clamp for dynamic counts
 * @param max             upper bound on instances
 * @param threshold       completions needed to continue; null means all instances
 * @param creationMode    how the instance count is known
 * @param countExpression JEXL expression giving the count for dynamic creation
 * @param synchronize     false lets instances run on without a join
 * @param cancelRemaining void the unfinished instances once the threshold is met
 */
public record MultiInstanceSpec(
        int min,
        int max,
        Integer threshold,
        CreationMode creationMode,
        String countExpression,
        boolean synchronize,
        boolean cancelRemaining
) {
    public MultiInstanceSpec {
        if (min < 0) {
            throw new IllegalArgumentException("Multi-instance min cannot be negative: " + min);
        }
        if (max < Math.max(min, 1)) {
            throw new IllegalArgumentException(
                    "Multi-instance max must be >= max(min, 1), got min=" + min + " max=" + max
            );
        }
        if (threshold != null && (threshold < 1 || threshold > max)) {
            throw new IllegalArgumentException(
                    "Multi-instance threshold must be within 1.." + max + ", got: " + threshold
            );
        }
        if (creationMode == null) {
            creationMode = CreationMode.STATIC;
        }
        if (creationMode == CreationMode.DYNAMIC && (countExpression == null || countExpression.isBlank())) {
            throw new IllegalArgumentException("Dynamic multi-instance tasks need a count expression");
        }
        if (cancelRemaining && threshold == null) {
            throw new IllegalArgumentException("cancelRemaining only makes sense with a threshold");
        }
    }

    public static MultiInstanceSpec fixed(int count) {
        return new MultiInstanceSpec(count, count, null, CreationMode.STATIC, null, true, false);
    }

    public boolean isPartial() {
        return threshold != null;
    }
}
