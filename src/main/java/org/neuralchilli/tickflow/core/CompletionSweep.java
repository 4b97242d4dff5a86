package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.domain.Node;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.kernel.DeltaWriter;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.LockFact;
import org.neuralchilli.tickflow.store.Snapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finishes automatic work: every ACTIVE ref holding a token completes in the
 * next tick and keeps its token for routing. Manual nodes wait for an
 * explicit completion; a multi-instance parent waits for its instances.
 * Completing releases the locks the ref holds.
 */
public class CompletionSweep {

    public List<Contribution> sweep(Snapshot snapshot) {
        List<Contribution> completions = new ArrayList<>();
        for (Map.Entry<NodeRef, NodeStatus> entry : snapshot.marking().statuses().entrySet()) {
            NodeRef ref = entry.getKey();
            if (entry.getValue() != NodeStatus.ACTIVE || !snapshot.hasToken(ref)) {
                continue;
            }
            Node node = snapshot.node(ref.nodeId());
            if (node.isManual() || (node.isMultiInstance() && !ref.isInstance())) {
                continue;
            }
            completions.add(Contribution.completion(ref, complete(snapshot, ref)));
        }
        return completions;
    }

    /**
     * Delta that completes one ref, used by the sweep and by explicit completion
     */
    public static Delta complete(Snapshot snapshot, NodeRef ref) {
        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.setStatus(ref, NodeStatus.COMPLETED);
        for (LockFact lock : snapshot.marking().locksHeldBy(ref)) {
            writer.remove(lock);
        }
        return writer.build();
    }
}
