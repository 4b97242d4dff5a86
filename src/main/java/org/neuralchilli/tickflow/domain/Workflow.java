package org.neuralchilli.tickflow.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A workflow net definition: nodes, flows and the case data predicates are
 * evaluated against. Validation here covers identity and referential
 * integrity only; shape checks live in the validator service.
 */
public final class Workflow {

    private final String name;
    private final String description;
    private final List<Node> nodes;
    private final List<Flow> flows;
    private final Map<String, Object> data;
    private final Map<String, Node> nodesById;

    public Workflow(
            String name,
            String description,
            List<Node> nodes,
            List<Flow> flows,
            Map<String, Object> data
    ) {
        // Validation
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9-]+$")) {
            throw new IllegalArgumentException(
                    "Workflow name must match pattern ^[a-z0-9-]+$, got: " + name
            );
        }

        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Workflow must have at least one node");
        }

        Map<String, Node> index = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (index.put(node.id(), node) != null) {
                throw new IllegalArgumentException(
                        "Duplicate node id '" + node.id() + "' in workflow " + name
                );
            }
        }

        List<Flow> flowList = flows != null ? flows : List.of();
        Set<String> flowKeys = new HashSet<>();
        for (Flow flow : flowList) {
            if (!index.containsKey(flow.source())) {
                throw new IllegalArgumentException(
                        "Flow " + flow.key() + " starts at unknown node '" + flow.source() + "'"
                );
            }
            if (!index.containsKey(flow.target())) {
                throw new IllegalArgumentException(
                        "Flow " + flow.key() + " ends at unknown node '" + flow.target() + "'"
                );
            }
            if (!flowKeys.add(flow.key())) {
                throw new IllegalArgumentException("Duplicate flow " + flow.key() + " in workflow " + name);
            }
        }

        this.name = name;
        this.description = description;
        this.nodes = List.copyOf(nodes);
        this.flows = List.copyOf(flowList);
        this.data = data != null ? Map.copyOf(data) : Map.of();
        this.nodesById = Map.copyOf(index);
    }

    // Getters
    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Flow> flows() {
        return flows;
    }

    public Map<String, Object> data() {
        return data;
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    /**
     * Get a node that is known to exist
     */
    public Node requireNode(String id) {
        Node node = nodesById.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node '" + id + "' in workflow " + name);
        }
        return node;
    }

    public boolean hasNode(String id) {
        return nodesById.containsKey(id);
    }

    /**
     * Output conditions a clean run is expected to complete
     */
    public List<Node> outputConditions() {
        return nodes.stream()
                .filter(n -> n.kind() == NodeKind.OUTPUT_CONDITION)
                .toList();
    }

    public Optional<Node> inputCondition() {
        return nodes.stream()
                .filter(n -> n.kind() == NodeKind.INPUT_CONDITION)
                .findFirst();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Workflow that = (Workflow) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.description, that.description) &&
                Objects.equals(this.nodes, that.nodes) &&
                Objects.equals(this.flows, that.flows) &&
                Objects.equals(this.data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, nodes, flows, data);
    }

    @Override
    public String toString() {
        return "Workflow[" +
                "name=" + name + ", " +
                "nodes=" + nodes.size() + ", " +
                "flows=" + flows.size() + ']';
    }

    /**
     * Builder for creating workflows fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private final List<Node> nodes = new ArrayList<>();
        private final List<Flow> flows = new ArrayList<>();
        private Map<String, Object> data = Map.of();

        public Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(node);
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            this.nodes.addAll(nodes);
            return this;
        }

        /**
         * Add plain tasks by id
         */
        public Builder tasks(String... ids) {
            for (String id : ids) {
                this.nodes.add(Node.task(id));
            }
            return this;
        }

        public Builder flow(Flow flow) {
            this.flows.add(flow);
            return this;
        }

        public Builder flow(String source, String target) {
            this.flows.add(Flow.of(source, target));
            return this;
        }

        public Builder flows(List<Flow> flows) {
            this.flows.addAll(flows);
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Workflow build() {
            return new Workflow(name, description, nodes, flows, data);
        }
    }
}
