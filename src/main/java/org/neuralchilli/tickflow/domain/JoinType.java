package org.neuralchilli.tickflow.domain;

/**
 * Incoming control behaviour of a node.
 */
public enum JoinType {
    NONE,
    AND,
    XOR,
    OR;

    public static JoinType fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return JoinType.valueOf(value.trim().toUpperCase());
    }
}
