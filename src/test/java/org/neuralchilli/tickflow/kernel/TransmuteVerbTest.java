package org.neuralchilli.tickflow.kernel;

import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.service.AmbiguousPatternException;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;
import org.neuralchilli.tickflow.store.VisitFact;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

class TransmuteVerbTest {

    private final TransmuteVerb verb = new TransmuteVerb();

    private static Workflow pair() {
        return Workflow.builder("pair")
                .tasks("a", "b")
                .flow("a", "b")
                .build();
    }

    @Test
    void shouldMoveTokenToTarget() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(pair())
                .marked("a", NodeStatus.COMPLETED)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("a"));

        // Then
        assertThat(delta.removals()).containsExactly(TokenFact.on(ref("a")));
        assertThat(delta.additions()).containsExactlyInAnyOrder(
                new StatusFact(ref("b"), NodeStatus.ACTIVE),
                TokenFact.on(ref("b")),
                new VisitFact("b", 1)
        );
    }

    @Test
    void shouldCountRevisit() {
        // Given: b finished an earlier iteration
        Snapshot snapshot = snapshot(GraphFacts.builder(pair())
                .marked("a", NodeStatus.COMPLETED)
                .status("b", NodeStatus.COMPLETED)
                .fact(new VisitFact("b", 1))
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("a"));

        // Then
        assertThat(delta.removals()).contains(new VisitFact("b", 1), new StatusFact(ref("b"), NodeStatus.COMPLETED));
        assertThat(delta.additions()).contains(new VisitFact("b", 2), new StatusFact(ref("b"), NodeStatus.ACTIVE));
    }

    @Test
    void shouldWaitWhileTargetIsBusy() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(pair())
                .marked("a", NodeStatus.COMPLETED)
                .marked("b", NodeStatus.ACTIVE)
                .build());

        // When / Then
        assertThat(verb.apply(snapshot, ref("a"))).isEqualTo(Delta.EMPTY);
    }

    @Test
    void shouldDropWorkHandedToVoidedTarget() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(pair())
                .marked("a", NodeStatus.COMPLETED)
                .status("b", NodeStatus.VOIDED)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("a"));

        // Then
        assertThat(delta.removals()).containsExactly(TokenFact.on(ref("a")));
        assertThat(delta.additions()).isEmpty();
    }

    @Test
    void shouldCarryThreadIdAlongFlow() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(pair())
                .status(NodeRef.of("a", 2), NodeStatus.COMPLETED)
                .token(NodeRef.of("a", 2))
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("a", 2));

        // Then
        assertThat(delta.additions()).contains(
                new StatusFact(ref("b", 2), NodeStatus.ACTIVE),
                TokenFact.on(ref("b", 2))
        );
    }

    @Test
    void shouldReportSeveralTargetsAsAmbiguous() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(Workflow.builder("fork")
                        .tasks("a", "b", "c")
                        .flow("a", "b")
                        .flow("a", "c")
                        .build())
                .marked("a", NodeStatus.COMPLETED)
                .build());

        // When / Then
        assertThatThrownBy(() -> verb.apply(snapshot, ref("a")))
                .isInstanceOf(AmbiguousPatternException.class)
                .hasMessageContaining("found 2");
    }

    @Test
    void shouldRejectNodeWithoutOutgoingFlow() {
        Snapshot snapshot = snapshot(GraphFacts.builder(Workflow.builder("dead-end")
                        .tasks("a")
                        .build())
                .marked("a", NodeStatus.COMPLETED)
                .build());

        assertThatThrownBy(() -> verb.apply(snapshot, ref("a")))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("found 0");
    }
}
