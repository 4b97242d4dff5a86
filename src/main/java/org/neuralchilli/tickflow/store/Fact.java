package org.neuralchilli.tickflow.store;

/**
 * One atomic piece of runtime state. The marking is a set of facts and every
 * change to it is expressed as facts added and removed.
 */
public sealed interface Fact
        permits StatusFact, TokenFact, ArrivalFact, JoinFact, GroupFact,
        MarkerFact, SignalFact, LockFact, VisitFact, BranchFact {

    /**
     * Slot occupied by this fact. Two facts with the same key never coexist
     * in a marking.
     */
    String key();

    /**
     * Node the fact is about, used in diagnostics and for deterministic ordering
     */
    String nodeId();
}
