package org.neuralchilli.tickflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.tickflow.domain.CreationMode;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.MutexKind;
import org.neuralchilli.tickflow.domain.MutexSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.domain.Workflow;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses YAML files into workflow definitions.
 */
@ApplicationScoped
public class WorkflowYamlParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a Workflow definition from YAML string
     */
    public Workflow parseWorkflow(String yamlContent) {
        Map<String, Object> data = yaml.load(yamlContent);
        return parseWorkflowFromMap(data);
    }

    /**
     * Parse a Workflow definition from InputStream
     */
    public Workflow parseWorkflow(InputStream inputStream) {
        Map<String, Object> data = yaml.load(inputStream);
        return parseWorkflowFromMap(data);
    }

    @SuppressWarnings("unchecked")
    private Workflow parseWorkflowFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Workflow document is empty");
        }
        String name = getString(data, "name", true);
        String description = getString(data, "description", false);

        Map<String, Object> caseData = new LinkedHashMap<>();
        Object rawData = data.get("data");
        if (rawData instanceof Map) {
            ((Map<?, ?>) rawData).forEach((k, v) -> {
                if (v != null) {
                    caseData.put(k.toString(), v);
                }
            });
        }

        List<Node> nodes = parseNodes((List<Map<String, Object>>) data.get("nodes"));
        List<Flow> flows = parseFlows((List<Map<String, Object>>) data.get("flows"));

        return new Workflow(name, description, nodes, flows, caseData);
    }

    @SuppressWarnings("unchecked")
    private List<Node> parseNodes(List<Map<String, Object>> nodesList) {
        if (nodesList == null || nodesList.isEmpty()) {
            throw new IllegalArgumentException("Workflow must have at least one node");
        }

        List<Node> result = new ArrayList<>();
        for (Map<String, Object> nodeData : nodesList) {
            String id = getString(nodeData, "id", true);
            Node.Builder builder = Node.builder(id)
                    .kind(NodeKind.fromString(getString(nodeData, "kind", false)))
                    .split(SplitType.fromString(getString(nodeData, "split", false)))
                    .join(JoinType.fromString(getString(nodeData, "join", false)))
                    .manual(getBoolean(nodeData, "manual", false))
                    .joinBehavior(JoinBehavior.fromString(getString(nodeData, "join-behavior", false)))
                    .quorum(getInteger(nodeData, "quorum"))
                    .cancellationTargets(new LinkedHashSet<>(getStringList(nodeData, "cancel", List.of())))
                    .nestedNodes(new LinkedHashSet<>(getStringList(nodeData, "nested", List.of())))
                    .milestone(getString(nodeData, "milestone", false))
                    .trigger(TriggerMode.fromString(getString(nodeData, "trigger", false)))
                    .deferred(getBoolean(nodeData, "deferred", false))
                    .threads(getInteger(nodeData, "threads"))
                    .terminatesCase(getBoolean(nodeData, "terminates-case", false));

            if (nodeData.containsKey("instances")) {
                builder.instances(parseInstances(id, (Map<String, Object>) nodeData.get("instances")));
            }
            if (nodeData.containsKey("mutex")) {
                Map<String, Object> mutex = (Map<String, Object>) nodeData.get("mutex");
                builder.mutex(new MutexSpec(
                        getString(mutex, "lock", true),
                        MutexKind.fromString(getString(mutex, "kind", false))
                ));
            }
            result.add(builder.build());
        }
        return result;
    }

    private MultiInstanceSpec parseInstances(String nodeId, Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Node '" + nodeId + "' declares empty instances");
        }
        int min = getInt(data, "min", 1);
        return new MultiInstanceSpec(
                min,
                getInt(data, "max", Math.max(min, 1)),
                getInteger(data, "threshold"),
                CreationMode.fromString(getString(data, "mode", false)),
                getString(data, "count", false),
                getBoolean(data, "synchronize", true),
                getBoolean(data, "cancel-remaining", false)
        );
    }

    private List<Flow> parseFlows(List<Map<String, Object>> flowsList) {
        if (flowsList == null) {
            return List.of();
        }

        List<Flow> result = new ArrayList<>();
        for (Map<String, Object> flowData : flowsList) {
            result.add(new Flow(
                    getString(flowData, "from", true),
                    getString(flowData, "to", true),
                    getString(flowData, "predicate", false),
                    getInt(flowData, "priority", 0),
                    getBoolean(flowData, "default", false),
                    getBoolean(flowData, "loop-back", false)
            ));
        }
        return result;
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Integer value = getInteger(map, key);
        return value != null ? value : defaultValue;
    }

    private Integer getInteger(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(Object::toString)
                    .collect(Collectors.toList());
        }
        return List.of(value.toString());
    }
}
