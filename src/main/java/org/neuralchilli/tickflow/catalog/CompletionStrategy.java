package org.neuralchilli.tickflow.catalog;

/**
 * Descriptive companion of {@link Threshold}, kept in the catalog so that
 * entries read the way the pattern literature names them.
 */
public enum CompletionStrategy {
    WAIT_ALL,
    WAIT_ACTIVE,
    WAIT_FIRST,
    WAIT_QUORUM;

    public static CompletionStrategy fromString(String value) {
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase();
        return CompletionStrategy.valueOf(normalized);
    }

    /**
     * Strategy a threshold implies when a catalog entry does not name one
     */
    public static CompletionStrategy defaultFor(Threshold threshold) {
        return switch (threshold) {
            case ALL -> WAIT_ALL;
            case ACTIVE, TOPOLOGY -> WAIT_ACTIVE;
            case ONE -> WAIT_FIRST;
            case N -> WAIT_QUORUM;
        };
    }
}
