package org.neuralchilli.tickflow.monitoring;

import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.core.Contribution;
import org.neuralchilli.tickflow.core.RunResult;
import org.neuralchilli.tickflow.core.WorkflowEngine;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

class ProvenanceRecorderTest {

    private static Workflow sequence() {
        return Workflow.builder("sequence")
                .node(input("start"))
                .tasks("A", "B", "C")
                .node(output("end"))
                .flow("start", "A")
                .flow("A", "B")
                .flow("B", "C")
                .flow("C", "end")
                .build();
    }

    private static ProvenanceRecorder run(Workflow workflow) {
        WorkflowEngine engine = engine(workflow);
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);
        engine.start();
        engine.runToCompletion();
        return recorder;
    }

    @Test
    void shouldRecordOneEntryPerTick() {
        // Given
        WorkflowEngine engine = engine(sequence());
        ProvenanceRecorder recorder = new ProvenanceRecorder();
        engine.addListener(recorder);

        // When
        engine.start();
        RunResult result = engine.runToCompletion();

        // Then
        assertThat(recorder.history()).hasSize(result.tickCount());
        assertThat(recorder.receipts()).hasSize(result.tickCount());
        assertThat(recorder.history().get(0).tickNumber()).isEqualTo(result.ticks().get(0).tickNumber());
        ProvenanceRecord last = recorder.history().get(recorder.history().size() - 1);
        assertThat(last.patternsFired()).isZero();
        assertThat(last.deltaSize()).isZero();
        assertThat(recorder.history()).allMatch(r -> r.durationNanos() >= 0);
    }

    @Test
    void shouldCountFiringsPerPattern() {
        // When
        ProvenanceRecorder recorder = run(sequence());

        // Then
        assertThat(recorder.patternCounts())
                .containsEntry(Contribution.COMPLETION, 5L)
                .containsEntry("sequence", 4L)
                .containsEntry("implicit-termination", 1L);
    }

    @Test
    void shouldSummarizeHistory() {
        // When
        ProvenanceStatistics statistics = run(sequence()).statistics();

        // Then
        assertThat(statistics.totalTicks()).isEqualTo(11);
        assertThat(statistics.totalPatternsFired()).isEqualTo(10);
        assertThat(statistics.averagePatternsPerTick()).isCloseTo(10.0 / 11, within(1e-9));
        assertThat(statistics.mostFiredPattern()).isEqualTo(Contribution.COMPLETION);
        assertThat(statistics.mostFiredCount()).isEqualTo(5);
        assertThat(new ProvenanceRecorder().statistics()).isEqualTo(ProvenanceStatistics.EMPTY);
    }

    @Test
    void shouldChainReceipts() {
        // When
        ProvenanceRecorder recorder = run(sequence());

        // Then
        assertThat(recorder.verifyChain()).isTrue();
        assertThat(recorder.receipts().get(0).previousHash()).isEmpty();
        for (int i = 1; i < recorder.receipts().size(); i++) {
            assertThat(recorder.receipts().get(i).previousHash())
                    .isEqualTo(recorder.receipts().get(i - 1).hash());
        }
        assertThat(recorder.receipts().get(0).toString()).startsWith("Receipt{tick=");
    }

    @Test
    void shouldProduceSameChainForReplay() {
        // When
        ProvenanceRecorder first = run(sequence());
        ProvenanceRecorder second = run(sequence());

        // Then
        assertThat(second.receipts()).isEqualTo(first.receipts());
    }

    @Test
    void shouldHashMarkingIndependentOfInsertionOrder() {
        // Given
        Workflow workflow = sequence();
        Snapshot forward = snapshot(GraphFacts.builder(workflow)
                .fact(new StatusFact(NodeRef.of("A"), NodeStatus.ACTIVE))
                .fact(TokenFact.on(NodeRef.of("A")))
                .build());
        Snapshot backward = snapshot(GraphFacts.builder(workflow)
                .fact(TokenFact.on(NodeRef.of("A")))
                .fact(new StatusFact(NodeRef.of("A"), NodeStatus.ACTIVE))
                .build());
        Snapshot other = snapshot(GraphFacts.builder(workflow)
                .marked("B", NodeStatus.ACTIVE)
                .build());

        // When / Then
        assertThat(ProvenanceRecorder.stateHash(forward)).isEqualTo(ProvenanceRecorder.stateHash(backward));
        assertThat(ProvenanceRecorder.stateHash(forward)).isNotEqualTo(ProvenanceRecorder.stateHash(other));
        assertThat(ProvenanceRecorder.sha256("")).hasSize(64);
    }

    @Test
    void shouldForgetEverythingOnClear() {
        // Given
        ProvenanceRecorder recorder = run(sequence());

        // When
        recorder.clear();

        // Then
        assertThat(recorder.history()).isEmpty();
        assertThat(recorder.receipts()).isEmpty();
        assertThat(recorder.patternCounts()).isEmpty();
        assertThat(recorder.verifyChain()).isTrue();
    }
}
