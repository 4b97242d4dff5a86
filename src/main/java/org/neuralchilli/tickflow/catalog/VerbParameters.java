package org.neuralchilli.tickflow.catalog;

/**
 * Verb-specific parameters of a catalog entry. The variant always matches
 * the entry's {@link Verb}.
 */
public sealed interface VerbParameters {

    Verb verb();

    record TransmuteParameters() implements VerbParameters {
        @Override
        public Verb verb() {
            return Verb.TRANSMUTE;
        }
    }

    record CopyParameters(Cardinality cardinality) implements VerbParameters {
        public CopyParameters {
            if (cardinality == null) {
                throw new IllegalArgumentException("Copy needs a cardinality");
            }
        }

        @Override
        public Verb verb() {
            return Verb.COPY;
        }
    }

    record FilterParameters(SelectionMode selectionMode) implements VerbParameters {
        public FilterParameters {
            if (selectionMode == null) {
                throw new IllegalArgumentException("Filter needs a selection mode");
            }
        }

        @Override
        public Verb verb() {
            return Verb.FILTER;
        }
    }

    /**
     * @param resetOnFire rearm once every predecessor has been absorbed;
     *                    when false the join stays spent until a RESET signal
     */
    record AwaitParameters(
            Threshold threshold,
            CompletionStrategy completionStrategy,
            boolean resetOnFire
    ) implements VerbParameters {
        public AwaitParameters {
            if (threshold == null) {
                throw new IllegalArgumentException("Await needs a threshold");
            }
            if (completionStrategy == null) {
                completionStrategy = CompletionStrategy.defaultFor(threshold);
            }
        }

        @Override
        public Verb verb() {
            return Verb.AWAIT;
        }
    }

    record VoidParameters(CancellationScope scope) implements VerbParameters {
        public VoidParameters {
            if (scope == null) {
                throw new IllegalArgumentException("Void needs a cancellation scope");
            }
        }

        @Override
        public Verb verb() {
            return Verb.VOID;
        }
    }
}
