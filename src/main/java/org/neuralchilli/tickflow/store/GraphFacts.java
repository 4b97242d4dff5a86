package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.Token;
import org.neuralchilli.tickflow.domain.Workflow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Bulk interchange form of a case: the workflow definition plus every fact of
 * its marking. Accepted by ingress and produced by export.
 */
public record GraphFacts(Workflow workflow, List<Fact> facts) {

    public GraphFacts {
        if (workflow == null) {
            throw new IllegalArgumentException("Graph facts need a workflow");
        }
        facts = facts != null
                ? facts.stream().sorted(Comparator.comparing(Fact::key)).toList()
                : List.of();
    }

    public static GraphFacts of(Workflow workflow) {
        return new GraphFacts(workflow, List.of());
    }

    public static Builder builder(Workflow workflow) {
        return new Builder(workflow);
    }

    /**
     * Builder for seeding a marking, mostly used by loaders and tests
     */
    public static class Builder {
        private final Workflow workflow;
        private final List<Fact> facts = new ArrayList<>();

        public Builder(Workflow workflow) {
            this.workflow = workflow;
        }

        public Builder status(String nodeId, NodeStatus status) {
            return status(NodeRef.of(nodeId), status);
        }

        public Builder status(NodeRef ref, NodeStatus status) {
            facts.add(new StatusFact(ref, status));
            return this;
        }

        public Builder token(String nodeId) {
            facts.add(new TokenFact(Token.on(nodeId)));
            return this;
        }

        public Builder token(NodeRef ref) {
            facts.add(TokenFact.on(ref));
            return this;
        }

        /**
         * Status plus token: the usual shape of enabled or finished-but-unrouted work
         */
        public Builder marked(String nodeId, NodeStatus status) {
            return status(nodeId, status).token(nodeId);
        }

        public Builder signal(String nodeId, SignalKind kind, String argument) {
            facts.add(new SignalFact(nodeId, kind, argument));
            return this;
        }

        public Builder fact(Fact fact) {
            facts.add(fact);
            return this;
        }

        public GraphFacts build() {
            return new GraphFacts(workflow, facts);
        }
    }
}
