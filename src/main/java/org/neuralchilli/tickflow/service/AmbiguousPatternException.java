package org.neuralchilli.tickflow.service;

/**
 * A node's shape matched no catalog entry, or matched one whose verb cannot
 * handle it. Reported as a warning; the node stays inert.
 */
public class AmbiguousPatternException extends WorkflowEngineException {

    public AmbiguousPatternException(String nodeId, String message) {
        super(nodeId, message);
    }
}
