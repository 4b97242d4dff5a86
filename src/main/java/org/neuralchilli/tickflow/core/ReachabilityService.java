package org.neuralchilli.tickflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.MaskSubgraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.store.ArrivalFact;
import org.neuralchilli.tickflow.store.Marking;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Live-path analysis over the workflow graph using JGraphT. Backs the
 * topology threshold of synchronizing merges.
 */
@ApplicationScoped
public class ReachabilityService {

    private static final Logger log = LoggerFactory.getLogger(ReachabilityService.class);

    /**
     * Nodes that still carry live work: token holders, ACTIVE refs and
     * targets of parked arrivals.
     */
    public Set<String> liveNodes(Snapshot snapshot) {
        Marking marking = snapshot.marking();
        Set<String> live = new TreeSet<>();
        marking.tokenRefs().forEach(ref -> live.add(ref.nodeId()));
        marking.statuses().forEach((ref, status) -> {
            if (status == NodeStatus.ACTIVE) {
                live.add(ref.nodeId());
            }
        });
        for (ArrivalFact arrival : marking.allArrivals()) {
            live.add(arrival.target());
        }
        return live;
    }

    /**
     * Check if a predecessor of {@code join} can no longer deliver work to it.
     * A predecessor is exhausted when it has completed or been voided and
     * holds no token, or when no live node can reach it without passing
     * through the join itself.
     */
    public boolean isExhausted(Snapshot snapshot, String predecessor, String join) {
        Marking marking = snapshot.marking();
        boolean holdsToken = marking.tokenRefs().stream().anyMatch(r -> r.nodeId().equals(predecessor));
        NodeStatus status = marking.status(NodeRef.of(predecessor));
        if (status.isTerminal() && !holdsToken) {
            return true;
        }

        Set<String> live = liveNodes(snapshot);
        live.remove(join);
        boolean reachable = canReach(snapshot.topology().graph(), live, predecessor, join);
        log.trace("Predecessor {} of {} reachable from live work: {}", predecessor, join, reachable);
        return !reachable;
    }

    /**
     * Check if live work can still bring {@code predecessor} to hand a unit
     * to {@code join}, whatever the predecessor's current status
     */
    public boolean canDeliver(Snapshot snapshot, String predecessor, String join) {
        Set<String> live = liveNodes(snapshot);
        live.remove(join);
        return canReach(snapshot.topology().graph(), live, predecessor, join);
    }

    /**
     * Breadth-first search from every source over the graph with
     * {@code excluded} masked out.
     */
    public boolean canReach(Graph<String, DefaultEdge> graph, Set<String> sources, String target, String excluded) {
        Graph<String, DefaultEdge> masked = new MaskSubgraph<>(graph, v -> v.equals(excluded), e -> false);
        Set<String> visited = new HashSet<>();
        for (String source : sources) {
            if (!masked.containsVertex(source) || visited.contains(source)) {
                continue;
            }
            BreadthFirstIterator<String, DefaultEdge> it = new BreadthFirstIterator<>(masked, source);
            while (it.hasNext()) {
                String vertex = it.next();
                if (vertex.equals(target)) {
                    return true;
                }
                visited.add(vertex);
            }
        }
        return false;
    }
}
