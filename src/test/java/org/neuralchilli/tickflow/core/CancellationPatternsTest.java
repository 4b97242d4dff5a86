package org.neuralchilli.tickflow.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.monitoring.ProvenanceRecorder;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.MarkerKind;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

/**
 * Cancel task, cancel on deadline, cancel case and cancel region.
 */
class CancellationPatternsTest {

    private static Workflow approval() {
        // start -> approve (manual) -> end
        return Workflow.builder("approval")
                .node(input("start"))
                .node(manual("approve"))
                .node(output("end"))
                .flow("start", "approve")
                .flow("approve", "end")
                .build();
    }

    @Test
    void shouldCancelRunningTask() {
        // Given
        WorkflowEngine engine = engine(approval());
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);
        engine.start();
        engine.runToCompletion();

        // When
        engine.signal("approve", SignalKind.CANCEL);
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(engine.statusOf("approve")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.hasToken(ref("approve"))).isFalse();
        assertThat(result.isDeadlocked()).isTrue();
        assertThat(result.deadlocks()).extracting(DeadlockWarning::nodeId).containsExactly("end");
        assertThat(recorder.patternCounts()).containsEntry("cancel-task", 1L);
    }

    @Test
    void shouldIgnoreCompletionAttemptOnCancelledTask() {
        // Given
        WorkflowEngine engine = engine(approval());
        engine.start();
        engine.runToCompletion();
        engine.signal("approve", SignalKind.CANCEL);
        engine.runToCompletion();

        // When / Then
        assertThatThrownBy(() -> engine.complete("approve"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("VOIDED");
    }

    @Test
    void shouldCancelTaskWhenDeadlineExpires() {
        // Given
        WorkflowEngine engine = engine(approval());
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);
        engine.start();
        engine.runToCompletion();

        // When
        engine.signal("approve", SignalKind.DEADLINE);
        engine.step();

        // Then
        assertThat(engine.statusOf("approve")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.snapshot().marking().signals("approve")).isEmpty();
        assertThat(recorder.patternCounts()).containsEntry("cancel-task-on-deadline", 1L);
    }

    @Test
    void shouldCancelWholeCase() {
        // Given: two manual branches still running
        Workflow workflow = Workflow.builder("claims")
                .node(input("start"))
                .node(Node.builder("split").split(SplitType.AND).build())
                .node(manual("assess"))
                .node(manual("pay"))
                .node(output("end"))
                .flow("start", "split")
                .flow("split", "assess")
                .flow("split", "pay")
                .flow("assess", "end")
                .flow("pay", "end")
                .build();
        WorkflowEngine engine = engine(workflow);
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);
        engine.start();
        engine.runToCompletion();

        // When
        engine.signal("start", SignalKind.CANCEL_CASE);
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(engine.statusOf("assess")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.statusOf("pay")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.statusOf("end")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.statusOf("split")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.snapshot().marking().tokenCount()).isZero();
        assertThat(result.converged()).isTrue();
        assertThat(recorder.patternCounts()).containsEntry("cancel-case", 1L);
    }

    @Test
    void shouldCancelRegionOfNodesAndFlows() {
        // Given: x cancels task y and the work parked on p->j
        Workflow workflow = Workflow.builder("region")
                .node(Node.builder("x").cancels("y", "p->j").build())
                .node(manual("y"))
                .node(Node.builder("p").split(SplitType.AND).build())
                .tasks("k", "q")
                .node(Node.builder("j").join(JoinType.AND).build())
                .flow("p", "j")
                .flow("p", "k")
                .flow("q", "j")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow)
                .marked("x", NodeStatus.COMPLETED)
                .marked("y", NodeStatus.ACTIVE)
                .status("p", NodeStatus.COMPLETED)
                .fact(new ArrivalFact("p", "j", null))
                .build());
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);

        // When
        engine.step();

        // Then
        assertThat(engine.statusOf("y")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.snapshot().marking().arrivals("j")).isEmpty();
        assertThat(engine.snapshot().marking().hasMarker("x", MarkerKind.REGION_CANCELLED)).isTrue();
        assertThat(engine.statusOf("p")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(recorder.patternCounts()).containsEntry("cancel-region", 1L);
    }

    @Test
    void shouldCancelRegionOnlyOnce() {
        // Given
        Workflow workflow = Workflow.builder("region-once")
                .node(Node.builder("x").cancels("y").build())
                .node(manual("y"))
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow)
                .marked("x", NodeStatus.COMPLETED)
                .marked("y", NodeStatus.ACTIVE)
                .build());
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(recorder.patternCounts())
                .containsEntry("cancel-region", 1L)
                .containsEntry("implicit-termination", 1L);
        assertThat(engine.hasToken(ref("x"))).isFalse();
        assertThat(engine.statusOf("x")).isEqualTo(NodeStatus.COMPLETED);
    }
}
