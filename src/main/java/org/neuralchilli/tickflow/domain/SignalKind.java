package org.neuralchilli.tickflow.domain;

/**
 * External events fed into a running case. The engine has no clock or
 * inbox of its own; everything from outside arrives as one of these.
 */
public enum SignalKind {
    /**
     * Cancel the addressed task (and its instances)
     */
    CANCEL,

    /**
     * Cancel the whole case
     */
    CANCEL_CASE,

    /**
     * A deadline resolved outside the engine has expired
     */
    DEADLINE,

    /**
     * Fire a transient or persistent trigger
     */
    TRIGGER,

    /**
     * Resolve a deferred choice; the argument names the chosen branch target
     */
    EVENT,

    /**
     * Add one instance to an incremental multi-instance task
     */
    ADD_INSTANCE,

    /**
     * Close an incremental multi-instance task to further instances
     */
    NO_MORE_INSTANCES,

    /**
     * Force completion of a multi-instance task
     */
    COMPLETE_INSTANCES,

    /**
     * Rearm a spent join
     */
    RESET;

    public static SignalKind fromString(String value) {
        return SignalKind.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
