package org.neuralchilli.tickflow.serializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.domain.CreationMode;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.MutexKind;
import org.neuralchilli.tickflow.domain.MutexSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeKind;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.TriggerMode;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.BranchFact;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.JoinFact;
import org.neuralchilli.tickflow.store.JoinState;
import org.neuralchilli.tickflow.store.LockFact;
import org.neuralchilli.tickflow.store.MarkerFact;
import org.neuralchilli.tickflow.store.MarkerKind;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.VisitFact;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class GraphFactsSerializerTest {

    private GraphFactsSerializer serializer;

    @BeforeEach
    void setup() {
        serializer = new GraphFactsSerializer();
    }

    private static Workflow claims() {
        return Workflow.builder("claims")
                .description("Claim handling")
                .data(Map.of("amount", 1500, "region", "emea"))
                .node(Node.builder("start").kind(NodeKind.INPUT_CONDITION).build())
                .node(Node.builder("triage").split(SplitType.XOR).cancels("review", "review->merge").build())
                .node(Node.builder("review")
                        .manual(true)
                        .instances(new MultiInstanceSpec(1, 4, 2, CreationMode.DYNAMIC, "${data.n}", true, true))
                        .mutex(new MutexSpec("desk", MutexKind.INTERLEAVED))
                        .build())
                .node(Node.builder("merge")
                        .join(JoinType.XOR)
                        .joinBehavior(JoinBehavior.BLOCKING_PARTIAL)
                        .quorum(1)
                        .nested("review")
                        .milestone("triage")
                        .trigger(TriggerMode.TRANSIENT)
                        .build())
                .node(Node.builder("end").kind(NodeKind.OUTPUT_CONDITION).terminatesCase(true).build())
                .flow("start", "triage")
                .flow(Flow.guarded("triage", "review", "${data.amount > 1000}", 1))
                .flow(Flow.of("triage", "merge").asDefault())
                .flow("review", "merge")
                .flow(Flow.of("merge", "end").asLoopBack())
                .build();
    }

    @Test
    void shouldPreserveWorkflowAndEveryFactKind() {
        // Given
        MultiInstanceGroup group = new MultiInstanceGroup("review", List.of(0, 1, 2), Set.of(1),
                1, 4, 2, CreationMode.DYNAMIC, false, true, false);
        GraphFacts facts = GraphFacts.builder(claims())
                .marked("triage", NodeStatus.COMPLETED)
                .status(NodeRef.of("review", 0), NodeStatus.ACTIVE)
                .token(NodeRef.of("review", 0))
                .status(NodeRef.of("review", 1), NodeStatus.COMPLETED)
                .signal("merge", SignalKind.TRIGGER, null)
                .signal("triage", SignalKind.EVENT, "review")
                .fact(new ArrivalFact("review", "merge", 1))
                .fact(new JoinFact("merge", new JoinState(Set.of("review"), "review")))
                .fact(new GroupFact(group))
                .fact(new MarkerFact("triage", MarkerKind.REGION_CANCELLED))
                .fact(new LockFact("desk", NodeRef.of("review", 0)))
                .fact(new VisitFact("triage", 2))
                .fact(new BranchFact("merge", "review"))
                .fact(new SignalFact("end", SignalKind.CANCEL, null, 5L))
                .build();

        // When
        GraphFacts restored = serializer.fromJson(serializer.toJson(facts));

        // Then
        assertThat(restored.workflow()).isEqualTo(facts.workflow());
        assertThat(restored.facts()).containsExactlyElementsOf(facts.facts());
    }

    @Test
    void shouldWriteReadableDocument() throws Exception {
        // Given
        GraphFacts facts = GraphFacts.builder(claims())
                .marked("start", NodeStatus.ACTIVE)
                .build();

        // When
        JsonNode json = new ObjectMapper().readTree(serializer.toJson(facts));

        // Then
        assertThat(json.path("workflow").path("name").asText()).isEqualTo("claims");
        assertThat(json.path("workflow").path("nodes")).hasSize(5);
        assertThat(json.path("facts")).hasSize(2);
        assertThat(json.path("facts").get(0).path("type").asText()).isIn("status", "token");
        assertThat(json.path("facts").get(0).path("node").asText()).isEqualTo("start");
    }

    @Test
    void shouldRejectUnknownFactType() {
        // Given
        ObjectNode root = serializer.write(GraphFacts.of(claims()));
        ((ArrayNode) root.get("facts")).addObject().put("type", "teleport");

        // When / Then
        assertThatThrownBy(() -> serializer.read(root))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown fact type: teleport");
    }

    @Test
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> serializer.fromJson("{\"facts\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing required field: workflow");
        assertThatThrownBy(() -> serializer.fromJson("[1, 2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid graph facts document");
    }
}
