package org.neuralchilli.tickflow.catalog;

/**
 * How a Filter picks among outgoing flows or contenders.
 */
public enum SelectionMode {
    EXACTLY_ONE,
    ONE_OR_MORE,
    DEFERRED,
    MUTEX,
    LOOP_CONDITION;

    /**
     * Accepts both {@code exactlyOne} and {@code exactly-one}
     */
    public static SelectionMode fromString(String value) {
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase();
        return SelectionMode.valueOf(normalized);
    }
}
