package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.Flow;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries over the units of work waiting in front of gated nodes.
 */
public final class Arrivals {

    private Arrivals() {
    }

    /**
     * Units waiting at {@code target}, ordered by inbound flow priority, then
     * declaration, then instance id. The first unit is the tie-break winner.
     */
    public static List<ArrivalUnit> waitingAt(Snapshot snapshot, String target) {
        Topology topology = snapshot.topology();
        Marking marking = snapshot.marking();
        List<ArrivalUnit> units = new ArrayList<>();

        for (ArrivalFact arrival : marking.arrivals(target)) {
            units.add(new ArrivalUnit(arrival.source(), arrival.instance(), arrival));
        }

        for (String predecessor : predecessorSet(snapshot, target)) {
            if (!topology.isPlainPredecessor(predecessor, target)) {
                continue;
            }
            for (NodeRef ref : marking.tokenRefs()) {
                if (ref.nodeId().equals(predecessor) && marking.status(ref) == NodeStatus.COMPLETED) {
                    units.add(new ArrivalUnit(predecessor, ref.instanceId(), TokenFact.on(ref)));
                }
            }
        }

        List<String> flowOrder = topology.flowsIn(target).stream().map(Flow::source).toList();
        units.sort(Comparator
                .comparingInt((ArrivalUnit u) -> flowOrder.indexOf(u.predecessor()))
                .thenComparing(ArrivalUnit::instance, Comparator.nullsFirst(Comparator.naturalOrder())));
        return units;
    }

    /**
     * Distinct predecessors of a node in inbound flow order
     */
    public static Set<String> predecessorSet(Snapshot snapshot, String target) {
        return new LinkedHashSet<>(snapshot.topology().predecessors(target));
    }

    /**
     * Distinct predecessors that have at least one unit waiting, in unit order
     */
    public static Set<String> arrivedPredecessors(List<ArrivalUnit> units) {
        Set<String> arrived = new LinkedHashSet<>();
        units.forEach(u -> arrived.add(u.predecessor()));
        return arrived;
    }

    /**
     * First unit of each predecessor, in unit order
     */
    public static List<ArrivalUnit> firstPerPredecessor(List<ArrivalUnit> units) {
        Set<String> seen = new LinkedHashSet<>();
        List<ArrivalUnit> result = new ArrayList<>();
        for (ArrivalUnit unit : units) {
            if (seen.add(unit.predecessor())) {
                result.add(unit);
            }
        }
        return result;
    }
}
