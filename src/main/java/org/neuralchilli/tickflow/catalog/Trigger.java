package org.neuralchilli.tickflow.catalog;

/**
 * Closed set of local shapes a catalog entry can match. The resolver
 * evaluates them; the catalog decides their order.
 */
public enum Trigger {
    /**
     * CANCEL_CASE signal on the node
     */
    CASE_CANCEL,

    /**
     * Output condition declared to terminate the case has been reached
     */
    EXPLICIT_TERMINATION,

    /**
     * CANCEL signal on a multi-instance task
     */
    MI_CANCEL,

    /**
     * CANCEL signal on a task
     */
    TASK_CANCEL,

    /**
     * DEADLINE signal on a node that has not completed
     */
    DEADLINE,

    /**
     * COMPLETE_INSTANCES signal on a running multi-instance task whose group is closed
     */
    MI_FORCE_COMPLETE,

    /**
     * Cancelling discriminator has fired and still has losing branches to clear
     */
    CANCELLING_DISCRIMINATOR_CLEANUP,

    /**
     * Cancelling partial join has fired and still has losing branches to clear
     */
    CANCELLING_PARTIAL_CLEANUP,

    /**
     * Multi-instance task passed its threshold and cancels the remaining instances
     */
    MI_CANCELLING_PARTIAL_CLEANUP,

    /**
     * Finished instance of a group that is not synchronized
     */
    MI_UNSYNCHRONIZED_INSTANCE_DONE,

    /**
     * Instance finishing after its parent already continued
     */
    MI_LATE_INSTANCE,

    /**
     * Every instance of a group that no longer gates its parent is terminal
     */
    MI_GROUP_SETTLED,

    STRUCTURED_DISCRIMINATOR,
    BLOCKING_DISCRIMINATOR,
    CANCELLING_DISCRIMINATOR,
    STRUCTURED_PARTIAL_JOIN,
    BLOCKING_PARTIAL_JOIN,
    CANCELLING_PARTIAL_JOIN,
    GENERALIZED_AND_JOIN,
    THREAD_MERGE,
    GENERAL_SYNC_MERGE,
    LOCAL_SYNC_MERGE,

    /**
     * OR-join with standard behaviour
     */
    STRUCTURED_SYNC_MERGE,

    /**
     * AND-join with standard behaviour
     */
    SYNCHRONIZATION,

    MILESTONE,
    TRANSIENT_TRIGGER,
    PERSISTENT_TRIGGER,
    INTERLEAVED_PARALLEL_ROUTING,
    CRITICAL_SECTION,
    INTERLEAVED_ROUTING,

    /**
     * ADD_INSTANCE or NO_MORE_INSTANCES signal on an incremental group still accepting
     */
    MI_EXTEND,

    MI_WITHOUT_SYNCHRONIZATION,
    MI_DESIGN_TIME,
    MI_RUNTIME,
    MI_NO_PRIOR_KNOWLEDGE,

    MI_CANCELLING_PARTIAL_JOIN,
    MI_STATIC_PARTIAL_JOIN,
    MI_DYNAMIC_PARTIAL_JOIN,
    MI_DESIGN_TIME_JOIN,
    MI_RUNTIME_JOIN,
    MI_NO_PRIOR_KNOWLEDGE_JOIN,

    /**
     * Completed node with a cancellation region not yet cleared
     */
    CANCEL_REGION,

    DEFERRED_CHOICE,
    STRUCTURED_LOOP,
    RECURSION,
    THREAD_SPLIT,
    PARALLEL_SPLIT,
    EXCLUSIVE_CHOICE,
    MULTI_CHOICE,
    ARBITRARY_CYCLE,
    MULTI_MERGE,
    SIMPLE_MERGE,
    SEQUENCE,

    /**
     * Completed node with nowhere to go
     */
    IMPLICIT_TERMINATION;

    public static Trigger fromString(String value) {
        return Trigger.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
