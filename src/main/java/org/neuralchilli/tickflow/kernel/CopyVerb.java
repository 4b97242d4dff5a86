package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.catalog.Cardinality;
import org.neuralchilli.tickflow.core.ExpressionEvaluator;
import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.MultiInstanceSpec;
import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;
import org.neuralchilli.tickflow.service.ExpressionException;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.GroupFact;
import org.neuralchilli.tickflow.store.MultiInstanceGroup;
import org.neuralchilli.tickflow.store.SignalFact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 1 -> N. Topology cardinality clones the token onto every outgoing flow;
 * the other cardinalities spawn threads or multi-instance children and open
 * or extend the parent's group.
 */
public class CopyVerb {

    private static final Logger log = LoggerFactory.getLogger(CopyVerb.class);

    private final MultiInstanceManager instances;
    private final ExpressionEvaluator evaluator;

    public CopyVerb(MultiInstanceManager instances, ExpressionEvaluator evaluator) {
        this.instances = instances;
        this.evaluator = evaluator;
    }

    public Delta apply(Snapshot snapshot, NodeRef subject, Cardinality cardinality) {
        Node node = snapshot.node(subject.nodeId());
        if (cardinality == Cardinality.TOPOLOGY) {
            return parallelSplit(snapshot, subject);
        }
        if (node.isMultiInstance()) {
            Optional<MultiInstanceGroup> group = snapshot.marking().group(node.id());
            return group.isPresent()
                    ? extend(snapshot, node, group.get())
                    : spawn(snapshot, subject, node, cardinality);
        }
        if (node.options().threads() != null) {
            return threadSplit(snapshot, subject, node);
        }
        throw new StructuralException(node.id(),
                "Copy with " + cardinality + " cardinality needs a multi-instance or thread declaration");
    }

    private Delta parallelSplit(Snapshot snapshot, NodeRef subject) {
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        if (flows.isEmpty()) {
            throw new StructuralException(subject.nodeId(), "Parallel split without outgoing flows");
        }
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        for (Flow flow : flows) {
            if (writer.deliver(flow, subject.instanceId()) == DeltaWriter.Outcome.BUSY) {
                return Delta.EMPTY;
            }
        }
        return writer.build();
    }

    private Delta threadSplit(Snapshot snapshot, NodeRef subject, Node node) {
        List<Flow> flows = snapshot.topology().flowsOut(node.id());
        if (flows.size() != 1) {
            throw new StructuralException(node.id(), "Thread split needs exactly one outgoing flow");
        }
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        for (int thread = 0; thread < node.options().threads(); thread++) {
            if (writer.deliver(flows.get(0), thread) == DeltaWriter.Outcome.BUSY) {
                return Delta.EMPTY;
            }
        }
        return writer.build();
    }

    private Delta spawn(Snapshot snapshot, NodeRef subject, Node node, Cardinality cardinality) {
        MultiInstanceSpec spec = node.options().instances();
        int countHint = 0;
        if (cardinality == Cardinality.DYNAMIC) {
            try {
                countHint = evaluator.evaluateCount(spec.countExpression(), evaluator.contextFor(snapshot, subject));
            } catch (ExpressionException e) {
                throw new StructuralException(node.id(), "Cannot evaluate instance count: " + e.getMessage(), e);
            }
        }

        MultiInstanceGroup group = instances.openGroup(node.id(), spec, cardinality, countHint);
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        for (Integer instance : group.instances()) {
            writer.activate(NodeRef.of(node.id(), instance));
        }
        writer.add(new GroupFact(group));

        if (!spec.synchronize()) {
            // The parent continues at once; its token goes back on for routing
            writer.setStatus(subject, NodeStatus.COMPLETED);
            writer.addToken(subject);
        }
        log.debug("Spawned {} instances of {}", group.size(), node.id());
        return writer.build();
    }

    private Delta extend(Snapshot snapshot, Node node, MultiInstanceGroup group) {
        DeltaWriter writer = new DeltaWriter(snapshot);
        MultiInstanceGroup next = group;

        Optional<SignalFact> add = snapshot.marking().signal(node.id(), SignalKind.ADD_INSTANCE);
        if (add.isPresent()) {
            writer.remove(add.get());
            if (next.size() < next.max()) {
                next = instances.extend(next);
                int created = next.instances().get(next.size() - 1);
                writer.activate(NodeRef.of(node.id(), created));
            } else {
                log.warn("Ignoring new instance for {}: maximum of {} reached", node.id(), next.max());
            }
        }

        Optional<SignalFact> close = snapshot.marking().signal(node.id(), SignalKind.NO_MORE_INSTANCES);
        if (close.isPresent()) {
            writer.remove(close.get());
            next = instances.stopAccepting(next);
        }

        if (!next.equals(group)) {
            writer.remove(new GroupFact(group));
            writer.add(new GroupFact(next));
        }
        return writer.build();
    }
}
