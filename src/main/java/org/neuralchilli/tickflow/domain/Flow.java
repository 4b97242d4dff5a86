package org.neuralchilli.tickflow.domain;

import javax.annotation.Nonnull;

/**
 * Directed arc between two nodes.
 *
 * @param predicate   JEXL guard used by XOR/OR splits and loops; null means always true
 * @param priority    lower value is evaluated first; ties fall back to declaration order
 * @param defaultFlow taken when no other guard of the split holds
 * @param loopBack    back edge of a structured loop
 */
public record Flow(
        String source,
        String target,
        String predicate,
        int priority,
        boolean defaultFlow,
        boolean loopBack
) {
    public Flow {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Flow source cannot be null or empty");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("Flow target cannot be null or empty");
        }
        if (predicate != null && predicate.isBlank()) {
            predicate = null;
        }
    }

    public static Flow of(String source, String target) {
        return new Flow(source, target, null, 0, false, false);
    }

    public static Flow guarded(String source, String target, String predicate, int priority) {
        return new Flow(source, target, predicate, priority, false, false);
    }

    /**
     * Key used in cancellation regions to address the flow
     */
    public String key() {
        return key(source, target);
    }

    public static String key(String source, String target) {
        return source + "->" + target;
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    public Flow asDefault() {
        return new Flow(source, target, predicate, priority, true, loopBack);
    }

    public Flow asLoopBack() {
        return new Flow(source, target, predicate, priority, defaultFlow, true);
    }

    @Nonnull
    @Override
    public String toString() {
        return key() + (predicate != null ? " [" + predicate + "]" : "");
    }
}
