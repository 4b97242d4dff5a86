package org.neuralchilli.tickflow.kernel;

import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.service.AmbiguousPatternException;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Snapshot;

import java.util.List;

/**
 * 1 -> 1: move the subject's token along its single outgoing flow.
 * A thread keeps its instance id.
 */
public class TransmuteVerb {

    public Delta apply(Snapshot snapshot, NodeRef subject) {
        List<Flow> flows = snapshot.topology().flowsOut(subject.nodeId());
        if (flows.size() > 1) {
            throw new AmbiguousPatternException(subject.nodeId(),
                    "Transmute needs exactly one outgoing flow, found " + flows.size());
        }
        if (flows.isEmpty()) {
            throw new StructuralException(subject.nodeId(), "Transmute needs exactly one outgoing flow, found 0");
        }

        DeltaWriter writer = new DeltaWriter(snapshot);
        writer.removeToken(subject);
        if (writer.deliver(flows.get(0), subject.instanceId()) == DeltaWriter.Outcome.BUSY) {
            return Delta.EMPTY;
        }
        return writer.build();
    }
}
