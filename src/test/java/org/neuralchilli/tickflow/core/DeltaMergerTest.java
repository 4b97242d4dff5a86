package org.neuralchilli.tickflow.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.catalog.PatternMapping;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

class DeltaMergerTest {

    private DeltaMerger merger;
    private Snapshot snapshot;
    private PatternMapping sequence;
    private PatternMapping cancelTask;

    @BeforeEach
    void setup() {
        merger = new DeltaMerger();
        // a and b both finished, both want to start t
        Workflow workflow = Workflow.builder("contested")
                .tasks("a", "b", "t")
                .flow("a", "t")
                .flow("b", "t")
                .build();
        snapshot = snapshot(GraphFacts.builder(workflow)
                .marked("a", NodeStatus.COMPLETED)
                .marked("b", NodeStatus.COMPLETED)
                .build());
        sequence = catalog().byName("sequence").orElseThrow();
        cancelTask = catalog().byName("cancel-task").orElseThrow();
    }

    private Contribution route(String source) {
        Delta delta = Delta.builder()
                .remove(TokenFact.on(ref(source)))
                .add(new StatusFact(ref("t"), NodeStatus.ACTIVE))
                .add(TokenFact.on(ref("t")))
                .build();
        return new Contribution(ref(source), sequence, delta);
    }

    private Contribution cancelT() {
        Delta delta = Delta.builder()
                .add(new StatusFact(ref("t"), NodeStatus.VOIDED))
                .build();
        return new Contribution(ref("t"), cancelTask, delta);
    }

    @Test
    void shouldDeferSecondClaimOnSameSlot() {
        // When
        MergeOutcome outcome = merger.merge(snapshot, List.of(route("b"), route("a")));

        // Then: subject order decides, not list order
        assertThat(outcome.accepted()).extracting(Contribution::subject).containsExactly(ref("a"));
        assertThat(outcome.deferred()).extracting(Contribution::subject).containsExactly(ref("b"));
        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.CONTESTED_CONSUMPTION);
        assertThat(outcome.delta().removals()).containsExactly(TokenFact.on(ref("a")));
    }

    @Test
    void shouldLetCancellationWinOverActivation() {
        // When
        MergeOutcome outcome = merger.merge(snapshot, List.of(route("a"), cancelT()));

        // Then
        assertThat(outcome.accepted()).containsExactly(cancelT());
        assertThat(outcome.deferred()).extracting(Contribution::subject).containsExactly(ref("a"));
        assertThat(outcome.diagnostics()).extracting(Diagnostic::kind)
                .containsExactly(DiagnosticKind.CANCELLATION_CONFLICT);
        assertThat(outcome.delta().additions()).containsExactly(new StatusFact(ref("t"), NodeStatus.VOIDED));
    }

    @Test
    void shouldAcceptOverlappingCancellations() {
        // Given
        Contribution again = new Contribution(ref("a"), cancelTask, Delta.builder()
                .add(new StatusFact(ref("t"), NodeStatus.VOIDED))
                .build());

        // When
        MergeOutcome outcome = merger.merge(snapshot, List.of(cancelT(), again));

        // Then
        assertThat(outcome.accepted()).hasSize(2);
        assertThat(outcome.deferred()).isEmpty();
        assertThat(outcome.delta().additions()).containsExactly(new StatusFact(ref("t"), NodeStatus.VOIDED));
    }

    @Test
    void shouldSkipContributionThatDoesNotFitMarking() {
        // Given: removes a token t never had
        Contribution broken = new Contribution(ref("t"), sequence, Delta.builder()
                .remove(TokenFact.on(ref("t")))
                .build());

        // When
        MergeOutcome outcome = merger.merge(snapshot, List.of(broken));

        // Then
        assertThat(outcome.accepted()).isEmpty();
        assertThat(outcome.delta().isEmpty()).isTrue();
        assertThat(outcome.diagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.kind()).isEqualTo(DiagnosticKind.STRUCTURAL);
                    assertThat(d.nodeId()).isEqualTo("t");
                });
    }

    @Test
    void shouldIgnoreEmptyContributions() {
        // When
        MergeOutcome outcome = merger.merge(snapshot,
                List.of(new Contribution(ref("a"), sequence, Delta.EMPTY)));

        // Then
        assertThat(outcome.accepted()).isEmpty();
        assertThat(outcome.deferred()).isEmpty();
        assertThat(outcome.diagnostics()).isEmpty();
    }

    @Test
    void shouldMergeToSameDeltaWhateverTheInputOrder() {
        // Given
        List<Contribution> contributions = new ArrayList<>(List.of(route("a"), route("b"), cancelT()));
        MergeOutcome first = merger.merge(snapshot, contributions);

        // When
        Collections.reverse(contributions);
        MergeOutcome second = merger.merge(snapshot, contributions);

        // Then
        assertThat(second.delta()).isEqualTo(first.delta());
        assertThat(second.accepted()).isEqualTo(first.accepted());
    }
}
