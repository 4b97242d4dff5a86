package org.neuralchilli.tickflow.service;

/**
 * Malformed topology or an invalid change around one node. The tick skips the
 * node's activation and carries on.
 */
public class StructuralException extends WorkflowEngineException {

    public StructuralException(String nodeId, String message) {
        super(nodeId, message);
    }

    public StructuralException(String nodeId, String message, Throwable cause) {
        super(nodeId, message, cause);
    }
}
