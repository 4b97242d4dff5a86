package org.neuralchilli.tickflow.domain;

/**
 * Flavour of mutual exclusion a node takes part in.
 */
public enum MutexKind {
    CRITICAL_SECTION,
    INTERLEAVED_PARALLEL,
    INTERLEAVED;

    public static MutexKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return CRITICAL_SECTION;
        }
        return MutexKind.valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
