package org.neuralchilli.tickflow.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.JoinBehavior;
import org.neuralchilli.tickflow.domain.JoinType;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.monitoring.ProvenanceRecorder;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.JoinState;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

/**
 * Multi-choice, the synchronizing merges, multi-merge, discriminators,
 * partial joins and thread split/merge.
 */
class AdvancedBranchingPatternsTest {

    private static ProvenanceRecorder record(WorkflowEngine engine) {
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);
        return recorder;
    }

    /**
     * p1 has finished; p2 and p3 are still being worked on by hand
     */
    private static WorkflowEngine threeIntoOne(Node join) {
        Workflow workflow = Workflow.builder("three-into-one")
                .node(Node.task("p1"))
                .node(manual("p2"))
                .node(manual("p3"))
                .node(join)
                .flow("p1", join.id())
                .flow("p2", join.id())
                .flow("p3", join.id())
                .build();
        return engine(GraphFacts.builder(workflow)
                .marked("p1", NodeStatus.COMPLETED)
                .marked("p2", NodeStatus.ACTIVE)
                .marked("p3", NodeStatus.ACTIVE)
                .build());
    }

    @Test
    void shouldActivateEveryBranchWhoseGuardHoldsAndSynchronizeThem() {
        // Given: a (OR) -> legal | finance | tax -> merge (OR)
        Workflow workflow = Workflow.builder("multi-choice")
                .data(Map.of("legal", true, "finance", true, "tax", false))
                .node(Node.builder("a").split(SplitType.OR).build())
                .tasks("legal", "finance", "tax")
                .node(Node.builder("merge").join(JoinType.OR).build())
                .flow(Flow.guarded("a", "legal", "${data.legal}", 0))
                .flow(Flow.guarded("a", "finance", "${data.finance}", 1))
                .flow(Flow.guarded("a", "tax", "${data.tax}", 2))
                .flow("legal", "merge")
                .flow("finance", "merge")
                .flow("tax", "merge")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("a", NodeStatus.COMPLETED).build());
        ProvenanceRecorder recorder = record(engine);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.statusOf("tax")).isEqualTo(NodeStatus.PENDING);
        assertThat(engine.snapshot().marking().visits("merge")).isEqualTo(1);
        assertThat(recorder.patternCounts())
                .containsEntry("multi-choice", 1L)
                .containsEntry("structured-synchronizing-merge", 1L);
        assertThat(engine.snapshot().marking().tokenCount()).isZero();
    }

    @Test
    void shouldMergeActivatedBranchesOnceWhenTheyDifferInLength() {
        // Given: s (OR) -> a1 -> a2 -> a3 -> j and s -> b -> j, j (OR) -> e
        Workflow workflow = Workflow.builder("uneven-branches")
                .node(Node.builder("s").split(SplitType.OR).build())
                .tasks("a1", "a2", "a3", "b")
                .node(Node.builder("j").join(JoinType.OR).build())
                .node(Node.task("e"))
                .flow(Flow.guarded("s", "a1", "${true}", 0))
                .flow(Flow.guarded("s", "b", "${true}", 1))
                .flow("a1", "a2")
                .flow("a2", "a3")
                .flow("a3", "j")
                .flow("b", "j")
                .flow("j", "e")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("s", NodeStatus.COMPLETED).build());
        ProvenanceRecorder recorder = record(engine);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("j")).isEqualTo(1);
        assertThat(engine.snapshot().marking().visits("e")).isEqualTo(1);
        assertThat(engine.statusOf("a3")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.snapshot().marking().branches("j")).isEmpty();
        assertThat(recorder.patternCounts()).containsEntry("structured-synchronizing-merge", 1L);
    }

    @Test
    void shouldNotWaitForBranchTheMultiChoiceSkipped() {
        // Given: only the long branch is taken; b stays idle
        Workflow workflow = Workflow.builder("one-branch-taken")
                .node(Node.builder("s").split(SplitType.OR).build())
                .tasks("a1", "a2", "b")
                .node(Node.builder("j").join(JoinType.OR).build())
                .flow(Flow.guarded("s", "a1", "${true}", 0))
                .flow(Flow.guarded("s", "b", "${false}", 1))
                .flow("a1", "a2")
                .flow("a2", "j")
                .flow("b", "j")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("s", NodeStatus.COMPLETED).build());

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("j")).isEqualTo(1);
        assertThat(engine.statusOf("b")).isEqualTo(NodeStatus.PENDING);
    }

    @Test
    void shouldActivateMultiMergeOncePerArrival() {
        // Given: a (AND) -> b, c -> m (multi-merge) -> e
        Workflow workflow = Workflow.builder("multi-merge")
                .node(Node.builder("a").split(SplitType.AND).build())
                .tasks("b", "c")
                .node(Node.builder("m").joinBehavior(JoinBehavior.MULTI_MERGE).build())
                .node(Node.task("e"))
                .flow("a", "b")
                .flow("a", "c")
                .flow("b", "m")
                .flow("c", "m")
                .flow("m", "e")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("a", NodeStatus.COMPLETED).build());
        ProvenanceRecorder recorder = record(engine);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("m")).isEqualTo(2);
        assertThat(engine.snapshot().marking().visits("e")).isEqualTo(2);
        assertThat(recorder.patternCounts()).containsEntry("multi-merge", 2L);
        assertThat(result.diagnostics()).extracting(Diagnostic::kind)
                .contains(DiagnosticKind.CONTESTED_CONSUMPTION);
    }

    @Test
    void shouldBlockDiscriminatorUntilReset() {
        // Given
        Workflow workflow = Workflow.builder("blocking")
                .tasks("p1", "p2", "p3")
                .node(Node.builder("d").join(JoinType.XOR)
                        .joinBehavior(JoinBehavior.BLOCKING_DISCRIMINATOR).build())
                .flow("p1", "d")
                .flow("p2", "d")
                .flow("p3", "d")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow)
                .marked("p1", NodeStatus.COMPLETED)
                .marked("p2", NodeStatus.COMPLETED)
                .marked("p3", NodeStatus.COMPLETED)
                .build());

        // When
        engine.runToCompletion();

        // Then
        assertThat(engine.snapshot().marking().visits("d")).isEqualTo(1);
        assertThat(engine.snapshot().marking().joinState("d"))
                .map(JoinState::absorbed)
                .hasValueSatisfying(absorbed -> assertThat(absorbed).containsExactly("p1", "p2", "p3"));

        // When
        engine.signal("d", SignalKind.RESET);
        engine.runToCompletion();

        // Then
        assertThat(engine.snapshot().marking().joinState("d")).isEmpty();
        assertThat(engine.snapshot().marking().signals("d")).isEmpty();
    }

    @Test
    void shouldCancelLosersOfCancellingDiscriminator() {
        // Given
        WorkflowEngine engine = threeIntoOne(Node.builder("d")
                .join(JoinType.XOR)
                .joinBehavior(JoinBehavior.CANCELLING_DISCRIMINATOR)
                .cancels("p2", "p3")
                .build());
        ProvenanceRecorder recorder = record(engine);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.statusOf("d")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.statusOf("p2")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.statusOf("p3")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.snapshot().marking().joinState("d")).isEmpty();
        assertThat(recorder.patternCounts())
                .containsEntry("cancelling-discriminator", 1L)
                .containsEntry("cancelling-discriminator-cleanup", 1L);
    }

    @Test
    void shouldFirePartialJoinAtQuorumAndRearmAfterLastArrival() {
        // Given
        Workflow workflow = Workflow.builder("partial")
                .tasks("p1", "p2")
                .node(manual("p3"))
                .node(Node.builder("d").join(JoinType.XOR)
                        .joinBehavior(JoinBehavior.PARTIAL).quorum(2).build())
                .flow("p1", "d")
                .flow("p2", "d")
                .flow("p3", "d")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow)
                .marked("p1", NodeStatus.COMPLETED)
                .marked("p2", NodeStatus.COMPLETED)
                .marked("p3", NodeStatus.ACTIVE)
                .build());

        // When
        engine.step();

        // Then
        assertThat(engine.statusOf("d")).isEqualTo(NodeStatus.ACTIVE);
        assertThat(engine.hasToken(ref("p1"))).isFalse();
        assertThat(engine.hasToken(ref("p2"))).isFalse();

        // When
        engine.runToCompletion();
        engine.complete("p3");
        engine.runToCompletion();

        // Then
        assertThat(engine.snapshot().marking().visits("d")).isEqualTo(1);
        assertThat(engine.snapshot().marking().joinState("d")).isEmpty();
        assertThat(engine.hasToken(ref("p3"))).isFalse();
    }

    @Test
    void shouldStaySpentAfterBlockingPartialJoin() {
        // Given
        WorkflowEngine engine = threeIntoOne(Node.builder("d")
                .join(JoinType.XOR)
                .joinBehavior(JoinBehavior.BLOCKING_PARTIAL)
                .quorum(2)
                .build());

        // When
        engine.complete("p2");
        engine.runToCompletion();
        engine.complete("p3");
        engine.runToCompletion();

        // Then
        assertThat(engine.snapshot().marking().visits("d")).isEqualTo(1);
        assertThat(engine.snapshot().marking().joinState("d")).isPresent();
        assertThat(engine.hasToken(ref("p3"))).isFalse();
    }

    @Test
    void shouldCancelRemainingBranchesOfCancellingPartialJoin() {
        // Given
        WorkflowEngine engine = threeIntoOne(Node.builder("d")
                .join(JoinType.XOR)
                .joinBehavior(JoinBehavior.CANCELLING_PARTIAL)
                .quorum(2)
                .cancels("p3")
                .build());

        // When
        engine.complete("p2");
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.statusOf("d")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.statusOf("p3")).isEqualTo(NodeStatus.VOIDED);
        assertThat(engine.snapshot().marking().visits("d")).isEqualTo(1);
    }

    @Test
    void shouldWaitForEveryBranchOfGeneralizedAndJoin() {
        // Given
        WorkflowEngine engine = threeIntoOne(Node.builder("d")
                .join(JoinType.AND)
                .joinBehavior(JoinBehavior.GENERALIZED_AND)
                .build());
        ProvenanceRecorder recorder = record(engine);

        // When
        engine.complete("p2");
        engine.runToCompletion();

        // Then
        assertThat(engine.statusOf("d")).isEqualTo(NodeStatus.PENDING);

        // When
        engine.complete("p3");
        engine.runToCompletion();

        // Then
        assertThat(engine.snapshot().marking().visits("d")).isEqualTo(1);
        assertThat(recorder.patternCounts()).containsEntry("generalized-and-join", 1L);
    }

    @Test
    void shouldWaitForBranchStillOnItsWayInLocalSynchronizingMerge() {
        // Given: the b branch is one step longer than the c branch
        Workflow workflow = Workflow.builder("local-sync")
                .node(Node.builder("a").split(SplitType.OR).build())
                .tasks("b", "b2", "c")
                .node(Node.builder("m").join(JoinType.OR)
                        .joinBehavior(JoinBehavior.LOCAL_SYNC_MERGE).build())
                .flow(Flow.guarded("a", "b", "${true}", 0))
                .flow(Flow.guarded("a", "c", "${true}", 1))
                .flow("b", "b2")
                .flow("b2", "m")
                .flow("c", "m")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("a", NodeStatus.COMPLETED).build());

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("m")).isEqualTo(1);
        assertThat(engine.statusOf("b2")).isEqualTo(NodeStatus.COMPLETED);
        assertThat(engine.snapshot().marking().tokenCount()).isZero();
    }

    @Test
    void shouldNotWaitForUnreachableBranchInGeneralSynchronizingMerge() {
        // Given: the choice goes to b, so c can never deliver
        Workflow workflow = Workflow.builder("general-sync")
                .node(Node.builder("a").split(SplitType.XOR).build())
                .tasks("b", "x", "c")
                .node(Node.builder("m").join(JoinType.OR)
                        .joinBehavior(JoinBehavior.GENERAL_SYNC_MERGE).build())
                .flow(Flow.guarded("a", "b", "${true}", 0))
                .flow(Flow.of("a", "x").asDefault())
                .flow("x", "c")
                .flow("b", "m")
                .flow("c", "m")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("a", NodeStatus.COMPLETED).build());
        ProvenanceRecorder recorder = record(engine);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("m")).isEqualTo(1);
        assertThat(engine.statusOf("c")).isEqualTo(NodeStatus.PENDING);
        assertThat(recorder.patternCounts()).containsEntry("general-synchronizing-merge", 1L);
    }

    @Test
    void shouldSplitIntoThreadsAndMergeThem() {
        // Given: t spawns three threads through w, merged again at m
        Workflow workflow = Workflow.builder("threads")
                .node(Node.builder("t").threads(3).build())
                .node(Node.task("w"))
                .node(Node.builder("m").joinBehavior(JoinBehavior.THREAD_MERGE).quorum(3).build())
                .flow("t", "w")
                .flow("w", "m")
                .build();
        WorkflowEngine engine = engine(GraphFacts.builder(workflow).marked("t", NodeStatus.COMPLETED).build());
        ProvenanceRecorder recorder = record(engine);

        // When
        engine.step();

        // Then
        assertThat(engine.statusOf(ref("w", 0))).isEqualTo(NodeStatus.ACTIVE);
        assertThat(engine.statusOf(ref("w", 1))).isEqualTo(NodeStatus.ACTIVE);
        assertThat(engine.statusOf(ref("w", 2))).isEqualTo(NodeStatus.ACTIVE);

        // When
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(result.converged()).isTrue();
        assertThat(engine.snapshot().marking().visits("w")).isEqualTo(3);
        assertThat(engine.snapshot().marking().visits("m")).isEqualTo(1);
        assertThat(engine.snapshot().marking().tokenCount()).isZero();
        assertThat(recorder.patternCounts())
                .containsEntry("thread-split", 1L)
                .containsEntry("thread-merge", 1L);
    }
}
