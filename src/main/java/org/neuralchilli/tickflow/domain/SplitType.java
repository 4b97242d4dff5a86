package org.neuralchilli.tickflow.domain;

/**
 * Outgoing control behaviour of a node.
 */
public enum SplitType {
    NONE,
    AND,
    XOR,
    OR;

    public static SplitType fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return SplitType.valueOf(value.trim().toUpperCase());
    }
}
