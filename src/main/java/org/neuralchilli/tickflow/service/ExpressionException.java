package org.neuralchilli.tickflow.service;

/**
 * Thrown when a flow predicate, loop guard or instance count expression
 * cannot be evaluated.
 */
public class ExpressionException extends WorkflowEngineException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
