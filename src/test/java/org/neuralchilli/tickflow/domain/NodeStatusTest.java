package org.neuralchilli.tickflow.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NodeStatusTest {

    @Test
    void shouldAllowLifecycleTransitions() {
        assertThat(NodeStatus.PENDING.canTransitionTo(NodeStatus.ACTIVE)).isTrue();
        assertThat(NodeStatus.ACTIVE.canTransitionTo(NodeStatus.COMPLETED)).isTrue();
        assertThat(NodeStatus.ACTIVE.canTransitionTo(NodeStatus.VOIDED)).isTrue();
        assertThat(NodeStatus.PENDING.canTransitionTo(NodeStatus.VOIDED)).isTrue();
    }

    @Test
    void shouldAllowLoopReentryOfCompletedNode() {
        assertThat(NodeStatus.COMPLETED.canTransitionTo(NodeStatus.ACTIVE)).isTrue();
        assertThat(NodeStatus.COMPLETED.canTransitionTo(NodeStatus.VOIDED)).isFalse();
    }

    @Test
    void shouldNeverLeaveVoided() {
        for (NodeStatus next : NodeStatus.values()) {
            assertThat(NodeStatus.VOIDED.canTransitionTo(next)).as("VOIDED -> %s", next).isFalse();
        }
    }

    @Test
    void shouldRankCancellationHighest() {
        assertThat(NodeStatus.VOIDED.precedence())
                .isGreaterThan(NodeStatus.COMPLETED.precedence());
        assertThat(NodeStatus.COMPLETED.precedence())
                .isGreaterThan(NodeStatus.ACTIVE.precedence());
        assertThat(NodeStatus.ACTIVE.precedence())
                .isGreaterThan(NodeStatus.PENDING.precedence());
        assertThat(NodeStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(NodeStatus.VOIDED.isTerminal()).isTrue();
        assertThat(NodeStatus.ACTIVE.isTerminal()).isFalse();
    }
}
