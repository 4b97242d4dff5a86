package org.neuralchilli.tickflow.catalog;

/**
 * The five elemental graph rewrites every pattern is built from.
 */
public enum Verb {
    /**
     * 1 -> 1: move a token along the single outgoing flow
     */
    TRANSMUTE,

    /**
     * 1 -> N: clone a token onto several targets or instances
     */
    COPY,

    /**
     * Selective routing among outgoing flows
     */
    FILTER,

    /**
     * N -> 1: synchronize arrivals against a threshold
     */
    AWAIT,

    /**
     * Cancellation within a scope
     */
    VOID;

    public static Verb fromString(String value) {
        return Verb.valueOf(value.trim().toUpperCase());
    }
}
