package org.neuralchilli.tickflow.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import org.neuralchilli.tickflow.domain.NodeOptions;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.Token;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.BranchFact;
import org.neuralchilli.tickflow.store.Fact;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.JoinFact;
import org.neuralchilli.tickflow.store.JoinState;
import org.neuralchilli.tickflow.store.LockFact;
import org.neuralchilli.tickflow.store.MarkerFact;
import org.neuralchilli.tickflow.store.MarkerKind;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;
import org.neuralchilli.tickflow.store.VisitFact;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON form of {@link GraphFacts}: the workflow definition plus every fact
 * of the marking. Written field by field so the format does not follow
 * refactorings of the domain records.
 */
@ApplicationScoped
public class GraphFactsSerializer {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(GraphFacts facts) {
        try {
            return mapper.writeValueAsString(write(facts));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize facts of " + facts.workflow().name(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not valid graph facts
     */
    public GraphFacts fromJson(String json) {
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph facts document: " + e.getOriginalMessage(), e);
        }
    }

    public ObjectNode write(GraphFacts facts) {
        ObjectNode root = mapper.createObjectNode();
        root.set("workflow", writeWorkflow(facts.workflow()));
        ArrayNode array = root.putArray("facts");
        facts.facts().forEach(f -> array.add(writeFact(f)));
        return root;
    }

    public GraphFacts read(JsonNode root) {
        Workflow workflow = readWorkflow(required(root, "workflow"));
        List<Fact> facts = new ArrayList<>();
        for (JsonNode fact : root.path("facts")) {
            facts.add(readFact(fact));
        }
        return new GraphFacts(workflow, facts);
    }

    // Workflow

    private ObjectNode writeWorkflow(Workflow workflow) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", workflow.name());
        node.put("description", workflow.description());
        node.set("data", mapper.valueToTree(workflow.data()));
        ArrayNode nodes = node.putArray("nodes");
        workflow.nodes().forEach(n -> nodes.add(writeNode(n)));
        ArrayNode flows = node.putArray("flows");
        workflow.flows().forEach(f -> flows.add(writeFlow(f)));
        return node;
    }

    private Workflow readWorkflow(JsonNode node) {
        List<Node> nodes = new ArrayList<>();
        node.path("nodes").forEach(n -> nodes.add(readNode(n)));
        List<Flow> flows = new ArrayList<>();
        node.path("flows").forEach(f -> flows.add(readFlow(f)));
        Map<String, Object> data = node.hasNonNull("data")
                ? mapper.convertValue(node.get("data"), new TypeReference<Map<String, Object>>() {
        })
                : Map.of();
        return new Workflow(
                required(node, "name").asText(),
                text(node, "description"),
                nodes,
                flows,
                data
        );
    }

    private ObjectNode writeNode(Node n) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", n.id());
        node.put("kind", n.kind().name());
        node.put("split", n.split().name());
        node.put("join", n.join().name());
        writeStrings(node.putArray("cancel"), n.cancellationTargets());

        NodeOptions options = n.options();
        node.put("manual", options.manual());
        node.put("joinBehavior", options.joinBehavior().name());
        putInteger(node, "quorum", options.quorum());
        writeStrings(node.putArray("nested"), options.nestedNodes());
        node.put("milestone", options.milestone());
        node.put("trigger", options.trigger().name());
        node.put("deferred", options.deferred());
        putInteger(node, "threads", options.threads());
        node.put("terminatesCase", options.terminatesCase());

        if (options.mutex() != null) {
            ObjectNode mutex = node.putObject("mutex");
            mutex.put("lock", options.mutex().lock());
            mutex.put("kind", options.mutex().kind().name());
        }
        MultiInstanceSpec spec = options.instances();
        if (spec != null) {
            ObjectNode instances = node.putObject("instances");
            instances.put("min", spec.min());
            instances.put("max", spec.max());
            putInteger(instances, "threshold", spec.threshold());
            instances.put("mode", spec.creationMode().name());
            instances.put("count", spec.countExpression());
            instances.put("synchronize", spec.synchronize());
            instances.put("cancelRemaining", spec.cancelRemaining());
        }
        return node;
    }

    private Node readNode(JsonNode node) {
        Node.Builder builder = Node.builder(required(node, "id").asText())
                .kind(NodeKind.valueOf(required(node, "kind").asText()))
                .split(SplitType.valueOf(required(node, "split").asText()))
                .join(JoinType.valueOf(required(node, "join").asText()))
                .cancellationTargets(readStrings(node.path("cancel")))
                .manual(node.path("manual").asBoolean(false))
                .joinBehavior(JoinBehavior.fromString(text(node, "joinBehavior")))
                .quorum(integer(node, "quorum"))
                .nestedNodes(readStrings(node.path("nested")))
                .milestone(text(node, "milestone"))
                .trigger(TriggerMode.fromString(text(node, "trigger")))
                .deferred(node.path("deferred").asBoolean(false))
                .threads(integer(node, "threads"))
                .terminatesCase(node.path("terminatesCase").asBoolean(false));

        JsonNode mutex = node.get("mutex");
        if (mutex != null && !mutex.isNull()) {
            builder.mutex(new MutexSpec(required(mutex, "lock").asText(), MutexKind.fromString(text(mutex, "kind"))));
        }
        JsonNode instances = node.get("instances");
        if (instances != null && !instances.isNull()) {
            builder.instances(new MultiInstanceSpec(
                    required(instances, "min").asInt(),
                    required(instances, "max").asInt(),
                    integer(instances, "threshold"),
                    CreationMode.fromString(text(instances, "mode")),
                    text(instances, "count"),
                    instances.path("synchronize").asBoolean(true),
                    instances.path("cancelRemaining").asBoolean(false)
            ));
        }
        return builder.build();
    }

    private ObjectNode writeFlow(Flow flow) {
        ObjectNode node = mapper.createObjectNode();
        node.put("from", flow.source());
        node.put("to", flow.target());
        node.put("predicate", flow.predicate());
        node.put("priority", flow.priority());
        node.put("default", flow.defaultFlow());
        node.put("loopBack", flow.loopBack());
        return node;
    }

    private Flow readFlow(JsonNode node) {
        return new Flow(
                required(node, "from").asText(),
                required(node, "to").asText(),
                text(node, "predicate"),
                node.path("priority").asInt(0),
                node.path("default").asBoolean(false),
                node.path("loopBack").asBoolean(false)
        );
    }

    // Facts

    private ObjectNode writeFact(Fact fact) {
        ObjectNode node = mapper.createObjectNode();
        if (fact instanceof StatusFact) {
            StatusFact status = (StatusFact) fact;
            node.put("type", "status");
            writeRef(node, status.ref());
            node.put("status", status.status().name());
        } else if (fact instanceof TokenFact) {
            node.put("type", "token");
            writeRef(node, ((TokenFact) fact).ref());
        } else if (fact instanceof ArrivalFact) {
            ArrivalFact arrival = (ArrivalFact) fact;
            node.put("type", "arrival");
            node.put("source", arrival.source());
            node.put("target", arrival.target());
            putInteger(node, "instance", arrival.instance());
        } else if (fact instanceof JoinFact) {
            JoinFact join = (JoinFact) fact;
            node.put("type", "join");
            node.put("node", join.nodeId());
            writeStrings(node.putArray("absorbed"), join.state().absorbed());
            node.put("winner", join.state().winner());
        } else if (fact instanceof GroupFact) {
            node.put("type", "group");
            writeGroup(node, ((GroupFact) fact).group());
        } else if (fact instanceof MarkerFact) {
            MarkerFact marker = (MarkerFact) fact;
            node.put("type", "marker");
            node.put("node", marker.nodeId());
            node.put("kind", marker.kind().name());
        } else if (fact instanceof SignalFact) {
            SignalFact signal = (SignalFact) fact;
            node.put("type", "signal");
            node.put("node", signal.nodeId());
            node.put("kind", signal.kind().name());
            node.put("argument", signal.argument());
            node.put("sequence", signal.sequence());
        } else if (fact instanceof LockFact) {
            LockFact lock = (LockFact) fact;
            node.put("type", "lock");
            node.put("lock", lock.lock());
            writeRef(node, lock.holder());
        } else if (fact instanceof VisitFact) {
            VisitFact visit = (VisitFact) fact;
            node.put("type", "visit");
            node.put("node", visit.nodeId());
            node.put("count", visit.count());
        } else if (fact instanceof BranchFact) {
            BranchFact branch = (BranchFact) fact;
            node.put("type", "branch");
            node.put("join", branch.join());
            node.put("predecessor", branch.predecessor());
        } else {
            throw new IllegalArgumentException("Unsupported fact: " + fact);
        }
        return node;
    }

    private Fact readFact(JsonNode node) {
        String type = required(node, "type").asText();
        return switch (type) {
            case "status" -> new StatusFact(readRef(node), NodeStatus.valueOf(required(node, "status").asText()));
            case "token" -> new TokenFact(Token.on(readRef(node)));
            case "arrival" -> new ArrivalFact(
                    required(node, "source").asText(),
                    required(node, "target").asText(),
                    integer(node, "instance"));
            case "join" -> new JoinFact(
                    required(node, "node").asText(),
                    new JoinState(readStrings(node.path("absorbed")), text(node, "winner")));
            case "group" -> new GroupFact(readGroup(node));
            case "marker" -> new MarkerFact(
                    required(node, "node").asText(),
                    MarkerKind.valueOf(required(node, "kind").asText()));
            case "signal" -> new SignalFact(
                    required(node, "node").asText(),
                    SignalKind.valueOf(required(node, "kind").asText()),
                    text(node, "argument"),
                    node.path("sequence").asLong(0L));
            case "lock" -> new LockFact(required(node, "lock").asText(), readRef(node));
            case "visit" -> new VisitFact(required(node, "node").asText(), required(node, "count").asInt());
            case "branch" -> new BranchFact(
                    required(node, "join").asText(),
                    required(node, "predecessor").asText());
            default -> throw new IllegalArgumentException("Unknown fact type: " + type);
        };
    }

    private void writeGroup(ObjectNode node, MultiInstanceGroup group) {
        node.put("node", group.parentNode());
        ArrayNode instances = node.putArray("instances");
        group.instances().forEach(instances::add);
        ArrayNode completed = node.putArray("completed");
        group.completed().forEach(completed::add);
        node.put("min", group.min());
        node.put("max", group.max());
        putInteger(node, "threshold", group.threshold());
        node.put("mode", group.creationMode().name());
        node.put("accepting", group.accepting());
        node.put("synchronize", group.synchronize());
        node.put("thresholdMet", group.thresholdMet());
    }

    private MultiInstanceGroup readGroup(JsonNode node) {
        List<Integer> instances = new ArrayList<>();
        node.path("instances").forEach(i -> instances.add(i.asInt()));
        Set<Integer> completed = new LinkedHashSet<>();
        node.path("completed").forEach(i -> completed.add(i.asInt()));
        return new MultiInstanceGroup(
                required(node, "node").asText(),
                instances,
                completed,
                required(node, "min").asInt(),
                required(node, "max").asInt(),
                integer(node, "threshold"),
                CreationMode.fromString(text(node, "mode")),
                node.path("accepting").asBoolean(false),
                node.path("synchronize").asBoolean(true),
                node.path("thresholdMet").asBoolean(false)
        );
    }

    // Helpers

    private void writeRef(ObjectNode node, NodeRef ref) {
        node.put("node", ref.nodeId());
        putInteger(node, "instance", ref.instanceId());
    }

    private NodeRef readRef(JsonNode node) {
        return new NodeRef(required(node, "node").asText(), integer(node, "instance"));
    }

    private void putInteger(ObjectNode node, String field, Integer value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }

    private void writeStrings(ArrayNode array, Set<String> values) {
        values.forEach(array::add);
    }

    private Set<String> readStrings(JsonNode array) {
        Set<String> values = new LinkedHashSet<>();
        array.forEach(v -> values.add(v.asText()));
        return values;
    }

    private JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field: " + field);
        }
        return value;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }
}
