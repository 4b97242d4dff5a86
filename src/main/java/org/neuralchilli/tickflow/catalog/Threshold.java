package org.neuralchilli.tickflow.catalog;

/**
 * When an Await fires, measured against the node's predecessor set.
 */
public enum Threshold {
    /**
     * Every predecessor has arrived
     */
    ALL,

    /**
     * Every predecessor that is currently enabled has arrived
     */
    ACTIVE,

    /**
     * First arrival wins
     */
    ONE,

    /**
     * A quorum of arrivals, taken from the node or its instance group
     */
    N,

    /**
     * No further arrival is structurally reachable from live work
     */
    TOPOLOGY;

    public static Threshold fromString(String value) {
        String v = value.trim().toUpperCase();
        if (v.equals("1")) {
            return ONE;
        }
        return Threshold.valueOf(v);
    }
}
