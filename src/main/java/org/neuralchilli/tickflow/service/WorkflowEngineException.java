package org.neuralchilli.tickflow.service;

/**
 * Base class of the engine's own failures. Carries the offending node id
 * where there is one.
 */
public class WorkflowEngineException extends RuntimeException {

    private final String nodeId;

    public WorkflowEngineException(String message) {
        this(null, message);
    }

    public WorkflowEngineException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public WorkflowEngineException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
