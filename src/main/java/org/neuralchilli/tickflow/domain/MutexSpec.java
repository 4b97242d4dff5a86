package org.neuralchilli.tickflow.domain;

/**
 * Membership of a node in a named mutual-exclusion set.
 */
public record MutexSpec(String lock, MutexKind kind) {

    public MutexSpec {
        if (lock == null || lock.isBlank()) {
            throw new IllegalArgumentException("Mutex lock name cannot be null or empty");
        }
        if (kind == null) {
            kind = MutexKind.CRITICAL_SECTION;
        }
    }
}
