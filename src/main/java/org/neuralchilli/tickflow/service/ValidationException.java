package org.neuralchilli.tickflow.service;

/**
 * Thrown when a workflow definition fails validation at load time.
 */
public class ValidationException extends WorkflowEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
