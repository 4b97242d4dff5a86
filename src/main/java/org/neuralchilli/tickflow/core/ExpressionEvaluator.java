package org.neuralchilli.tickflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.service.ExpressionException;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Evaluates JEXL guards and counts. Expressions are written as
 * {@code ${...}}; anything else is taken literally.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;

    public ExpressionEvaluator() {
        this.jexl = new JexlBuilder()
                .cache(512)  // Cache up to 512 expressions
                .strict(false)  // Allow null-safe navigation
                .silent(false)  // Surface errors as exceptions
                .permissions(JexlPermissions.UNRESTRICTED)  // Allow method calls
                .create();
    }

    /**
     * Context for evaluating an expression on behalf of {@code subject}
     */
    public ExpressionContext contextFor(Snapshot snapshot, NodeRef subject) {
        return new ExpressionContext(
                snapshot.data(),
                snapshot.marking().allVisits(),
                subject.nodeId(),
                subject.instanceId()
        );
    }

    /**
     * Evaluate an expression to its raw object type.
     */
    public Object evaluateToObject(String expression, ExpressionContext context) {
        if (expression == null) {
            return null;
        }

        if (!isExpression(expression)) {
            return expression;
        }

        try {
            JexlExpression compiled = jexl.createExpression(extractExpression(expression));
            return compiled.evaluate(createJexlContext(context));
        } catch (Exception e) {
            String msg = String.format(
                    "Failed to evaluate expression: %s - %s",
                    expression,
                    e.getMessage()
            );
            log.debug(msg, e);
            throw new ExpressionException(msg, e);
        }
    }

    /**
     * Evaluate a guard. A missing guard holds.
     *
     * @throws ExpressionException if the guard fails or does not yield a boolean
     */
    public boolean evaluateBoolean(String expression, ExpressionContext context) {
        if (expression == null) {
            return true;
        }
        Object result = evaluateToObject(expression, context);
        if (result instanceof Boolean) {
            return (Boolean) result;
        }
        if (result instanceof String) {
            String text = ((String) result).trim();
            if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new ExpressionException("Guard " + expression + " did not yield a boolean: " + result);
    }

    /**
     * Evaluate an instance count.
     *
     * @throws ExpressionException if the result is not a number or a collection
     */
    public int evaluateCount(String expression, ExpressionContext context) {
        Object result = evaluateToObject(expression, context);
        if (result instanceof Number) {
            return ((Number) result).intValue();
        }
        if (result instanceof Collection) {
            return ((Collection<?>) result).size();
        }
        if (result instanceof String) {
            try {
                return Integer.parseInt(((String) result).trim());
            } catch (NumberFormatException e) {
                throw new ExpressionException("Count " + expression + " is not a number: " + result, e);
            }
        }
        throw new ExpressionException("Count " + expression + " did not yield a number: " + result);
    }

    /**
     * Check if a string contains an expression
     */
    public boolean isExpression(String value) {
        return value != null && value.contains("${") && value.contains("}");
    }

    private String extractExpression(String expression) {
        String trimmed = expression.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            return trimmed.substring(2, trimmed.length() - 1);
        }
        return trimmed;
    }

    private JexlContext createJexlContext(ExpressionContext context) {
        MapContext jexlContext = new MapContext();

        jexlContext.set("data", context.data());
        jexlContext.set("visits", context.visits());
        jexlContext.set("node", context.node());
        jexlContext.set("instance", context.instance());

        // Add Math class for math functions
        jexlContext.set("Math", Math.class);

        return jexlContext;
    }

    /**
     * Test if an expression is valid (can be compiled)
     */
    public boolean isValid(String expression) {
        return getValidationError(expression) == null;
    }

    /**
     * Get a detailed error message for an invalid expression
     */
    public String getValidationError(String expression) {
        if (!isExpression(expression)) {
            return null;
        }

        try {
            jexl.createExpression(extractExpression(expression));
            return null;
        } catch (Exception e) {
            return e.getMessage();
        }
    }
}
