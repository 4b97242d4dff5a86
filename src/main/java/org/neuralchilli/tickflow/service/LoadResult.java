package org.neuralchilli.tickflow.service;

import java.util.Optional;

/**
 * Result of loading a workflow file.
 * Provides type-safe success/failure handling with clear error messages.
 */
public sealed interface LoadResult {

    /**
     * Check if load was successful
     */
    boolean isSuccess();

    /**
     * Workflow name on success, file name on failure
     */
    String name();

    /**
     * Get error message if failed
     */
    Optional<String> error();

    /**
     * Successful load result
     *
     * @param warnings validation findings that did not prevent the load
     */
    record Success(String name, int warnings) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<String> error() {
            return Optional.empty();
        }
    }

    /**
     * Failed load result with error message
     */
    record Failure(String name, String errorMessage) implements LoadResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<String> error() {
            return Optional.of(errorMessage);
        }
    }

    static LoadResult success(String name) {
        return new Success(name, 0);
    }

    static LoadResult success(String name, int warnings) {
        return new Success(name, warnings);
    }

    static LoadResult failure(String name, String error) {
        return new Failure(name, error);
    }

    /**
     * Create a failure result from exception
     */
    static LoadResult failure(String name, Exception e) {
        return new Failure(name, e.getMessage());
    }
}
