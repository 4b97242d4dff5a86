package org.neuralchilli.tickflow.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Variables visible to flow predicates, loop guards and instance counts.
 */
public final class ExpressionContext {

    private final Map<String, Object> data;
    private final Map<String, Integer> visits;
    private final String node;
    private final Integer instance;

    public ExpressionContext(
            Map<String, Object> data,
            Map<String, Integer> visits,
            String node,
            Integer instance
    ) {
        this.data = data != null ? new HashMap<>(data) : Map.of();
        this.visits = visits != null ? new HashMap<>(visits) : Map.of();
        this.node = node;
        this.instance = instance;
    }

    /**
     * Case data
     */
    public Map<String, Object> data() {
        return data;
    }

    /**
     * Activation count per node id
     */
    public Map<String, Integer> visits() {
        return visits;
    }

    public String node() {
        return node;
    }

    public Integer instance() {
        return instance;
    }

    /**
     * Create a context with only case data
     */
    public static ExpressionContext withData(Map<String, Object> data) {
        return new ExpressionContext(data, Map.of(), null, null);
    }

    /**
     * Create an empty context
     */
    public static ExpressionContext empty() {
        return new ExpressionContext(Map.of(), Map.of(), null, null);
    }
}
