package org.neuralchilli.tickflow.catalog;

/**
 * How many units a Copy produces.
 */
public enum Cardinality {
    /**
     * One per outgoing flow (parallel split)
     */
    TOPOLOGY,

    /**
     * A count known at design time
     */
    STATIC,

    /**
     * A count evaluated from case data when the copy fires
     */
    DYNAMIC,

    /**
     * One now, more on request until the group is closed
     */
    INCREMENTAL;

    public static Cardinality fromString(String value) {
        return Cardinality.valueOf(value.trim().toUpperCase());
    }
}
