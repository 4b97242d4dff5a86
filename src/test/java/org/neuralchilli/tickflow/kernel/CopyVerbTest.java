package org.neuralchilli.tickflow.kernel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.tickflow.catalog.Cardinality;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.domain.CreationMode;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.domain.SplitType;
import org.neuralchilli.tickflow.domain.Workflow;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GraphFacts;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;
import org.neuralchilli.tickflow.store.VisitFact;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.tickflow.EngineFixtures.*;

class CopyVerbTest {

    private MultiInstanceManager instances;
    private CopyVerb verb;

    @BeforeEach
    void setup() {
        instances = new MultiInstanceManager();
        verb = new CopyVerb(instances, new ExpressionEvaluator());
    }

    private static Workflow multiInstance(MultiInstanceSpec spec, Map<String, Object> data) {
        return Workflow.builder("instances")
                .data(data)
                .node(Node.builder("r").instances(spec).build())
                .tasks("end")
                .flow("r", "end")
                .build();
    }

    @Test
    void shouldCloneTokenOntoEveryOutgoingFlow() {
        // Given
        Workflow workflow = Workflow.builder("split")
                .node(Node.builder("s").split(SplitType.AND).build())
                .tasks("x", "y")
                .flow("s", "x")
                .flow("s", "y")
                .build();
        Snapshot snapshot = snapshot(GraphFacts.builder(workflow).marked("s", NodeStatus.COMPLETED).build());

        // When
        Delta delta = verb.apply(snapshot, ref("s"), Cardinality.TOPOLOGY);

        // Then
        assertThat(delta.removals()).containsExactly(TokenFact.on(ref("s")));
        assertThat(delta.additions()).containsExactlyInAnyOrder(
                new StatusFact(ref("x"), NodeStatus.ACTIVE), TokenFact.on(ref("x")), new VisitFact("x", 1),
                new StatusFact(ref("y"), NodeStatus.ACTIVE), TokenFact.on(ref("y")), new VisitFact("y", 1)
        );
    }

    @Test
    void shouldHoldSplitWhileAnyBranchIsBusy() {
        // Given
        Workflow workflow = Workflow.builder("split")
                .node(Node.builder("s").split(SplitType.AND).build())
                .tasks("x", "y")
                .flow("s", "x")
                .flow("s", "y")
                .build();
        Snapshot snapshot = snapshot(GraphFacts.builder(workflow)
                .marked("s", NodeStatus.COMPLETED)
                .marked("y", NodeStatus.ACTIVE)
                .build());

        // When / Then
        assertThat(verb.apply(snapshot, ref("s"), Cardinality.TOPOLOGY)).isEqualTo(Delta.EMPTY);
    }

    @Test
    void shouldSpawnNumberedThreadsOnSingleFlow() {
        // Given
        Workflow workflow = Workflow.builder("threads")
                .node(Node.builder("t").threads(3).build())
                .tasks("w")
                .flow("t", "w")
                .build();
        Snapshot snapshot = snapshot(GraphFacts.builder(workflow).marked("t", NodeStatus.COMPLETED).build());

        // When
        Delta delta = verb.apply(snapshot, ref("t"), Cardinality.STATIC);

        // Then
        assertThat(delta.additions()).contains(
                TokenFact.on(ref("w", 0)),
                TokenFact.on(ref("w", 1)),
                TokenFact.on(ref("w", 2)),
                new StatusFact(ref("w", 2), NodeStatus.ACTIVE),
                new VisitFact("w", 3)
        );
        assertThat(delta.removals()).containsExactly(TokenFact.on(ref("t")));
    }

    @Test
    void shouldSpawnStaticInstancesAndOpenGroup() {
        // Given
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(MultiInstanceSpec.fixed(2), Map.of()))
                .marked("r", NodeStatus.ACTIVE)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.STATIC);

        // Then
        assertThat(delta.removals()).containsExactly(TokenFact.on(ref("r")));
        assertThat(delta.additions()).contains(
                new StatusFact(ref("r", 0), NodeStatus.ACTIVE),
                new StatusFact(ref("r", 1), NodeStatus.ACTIVE),
                TokenFact.on(ref("r", 0)),
                TokenFact.on(ref("r", 1)),
                new VisitFact("r", 2)
        );
        assertThat(delta.additions())
                .filteredOn(GroupFact.class::isInstance)
                .singleElement()
                .satisfies(fact -> assertThat(((GroupFact) fact).group().instances()).containsExactly(0, 1));
    }

    @Test
    void shouldLetParentContinueWithoutSynchronization() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(2, 2, null, CreationMode.STATIC, null, false, false);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of()))
                .marked("r", NodeStatus.ACTIVE)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.STATIC);

        // Then: the parent keeps its token and is done
        assertThat(delta.removals()).containsExactly(new StatusFact(ref("r"), NodeStatus.ACTIVE));
        assertThat(delta.additions()).contains(new StatusFact(ref("r"), NodeStatus.COMPLETED));
        assertThat(delta.additions()).doesNotContain(TokenFact.on(ref("r")));
    }

    @Test
    void shouldSizeDynamicGroupFromCaseData() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(1, 5, null, CreationMode.DYNAMIC, "${data.n}", true, false);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of("n", 3)))
                .marked("r", NodeStatus.ACTIVE)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.DYNAMIC);

        // Then
        assertThat(delta.additions()).contains(TokenFact.on(ref("r", 2)), new VisitFact("r", 3));
        assertThat(delta.additions()).doesNotContain(TokenFact.on(ref("r", 3)));
    }

    @Test
    void shouldReportUnusableInstanceCount() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(1, 5, null, CreationMode.DYNAMIC, "${data.n}", true, false);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of("n", "many")))
                .marked("r", NodeStatus.ACTIVE)
                .build());

        // When / Then
        assertThatThrownBy(() -> verb.apply(snapshot, ref("r"), Cardinality.DYNAMIC))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Cannot evaluate instance count");
    }

    @Test
    void shouldAddInstanceOnRequest() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(1, 3, null, CreationMode.INCREMENTAL, null, true, false);
        MultiInstanceGroup group = instances.openGroup("r", spec, Cardinality.INCREMENTAL, 0);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of()))
                .status("r", NodeStatus.ACTIVE)
                .fact(new GroupFact(group))
                .fact(new VisitFact("r", 2))
                .signal("r", SignalKind.ADD_INSTANCE, null)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.INCREMENTAL);

        // Then
        assertThat(delta.removals()).contains(
                new SignalFact("r", SignalKind.ADD_INSTANCE, null),
                new GroupFact(group),
                new VisitFact("r", 2)
        );
        assertThat(delta.additions()).contains(
                new StatusFact(ref("r", 1), NodeStatus.ACTIVE),
                TokenFact.on(ref("r", 1)),
                new GroupFact(instances.extend(group)),
                new VisitFact("r", 3)
        );
    }

    @Test
    void shouldIgnoreInstanceRequestBeyondMax() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(1, 1, null, CreationMode.INCREMENTAL, null, true, false);
        MultiInstanceGroup group = instances.openGroup("r", spec, Cardinality.INCREMENTAL, 0);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of()))
                .status("r", NodeStatus.ACTIVE)
                .fact(new GroupFact(group))
                .signal("r", SignalKind.ADD_INSTANCE, null)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.INCREMENTAL);

        // Then
        assertThat(delta.removals()).containsExactly(new SignalFact("r", SignalKind.ADD_INSTANCE, null));
        assertThat(delta.additions()).isEmpty();
    }

    @Test
    void shouldStopAcceptingOnNoMoreInstances() {
        // Given
        MultiInstanceSpec spec = new MultiInstanceSpec(1, 3, null, CreationMode.INCREMENTAL, null, true, false);
        MultiInstanceGroup group = instances.openGroup("r", spec, Cardinality.INCREMENTAL, 0);
        Snapshot snapshot = snapshot(GraphFacts.builder(multiInstance(spec, Map.of()))
                .status("r", NodeStatus.ACTIVE)
                .fact(new GroupFact(group))
                .signal("r", SignalKind.NO_MORE_INSTANCES, null)
                .build());

        // When
        Delta delta = verb.apply(snapshot, ref("r"), Cardinality.INCREMENTAL);

        // Then
        assertThat(delta.additions()).containsExactly(new GroupFact(group.withAccepting(false)));
        assertThat(delta.removals()).containsExactlyInAnyOrder(
                new SignalFact("r", SignalKind.NO_MORE_INSTANCES, null),
                new GroupFact(group)
        );
    }

    @Test
    void shouldRejectInstanceCopyOnPlainTask() {
        Snapshot snapshot = snapshot(GraphFacts.builder(Workflow.builder("plain")
                        .tasks("a", "b")
                        .flow("a", "b")
                        .build())
                .marked("a", NodeStatus.ACTIVE)
                .build());

        assertThatThrownBy(() -> verb.apply(snapshot, ref("a"), Cardinality.STATIC))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("multi-instance or thread");
    }
}
