package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.service.StructuralException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds the workflow structure and the current marking. Single writer: the
 * tick executor owns it between ticks, nothing mutates it mid-tick.
 */
public class TopologyStore {

    private static final Logger log = LoggerFactory.getLogger(TopologyStore.class);

    private Topology topology;
    private Marking marking = Marking.empty();
    private long generation;

    /**
     * Replace structure and marking in one step
     *
     * @throws IllegalArgumentException if a fact names an unknown node or two facts share a slot
     */
    public void load(GraphFacts facts) {
        Topology next = new Topology(facts.workflow());
        for (Fact fact : facts.facts()) {
            if (!next.hasNode(fact.nodeId())) {
                throw new IllegalArgumentException(
                        "Fact " + fact + " refers to unknown node '" + fact.nodeId() + "'"
                );
            }
        }
        this.topology = next;
        this.marking = Marking.of(facts.facts());
        this.generation++;
        log.debug("Loaded topology '{}' with {} facts (generation {})",
                facts.workflow().name(), marking.size(), generation);
    }

    public boolean isLoaded() {
        return topology != null;
    }

    public Snapshot snapshot() {
        requireLoaded();
        return new Snapshot(generation, topology, marking);
    }

    /**
     * Apply a delta atomically: all of it or none of it.
     *
     * @throws StructuralException if the delta does not fit the current marking
     */
    public Snapshot apply(Delta delta) {
        Snapshot current = snapshot();
        check(current, delta);
        if (delta.isEmpty()) {
            return current;
        }
        if (log.isTraceEnabled()) {
            delta.removals().forEach(f -> log.trace("  - {}", f));
            delta.additions().forEach(f -> log.trace("  + {}", f));
        }
        this.marking = marking.apply(delta);
        this.generation++;
        return snapshot();
    }

    public GraphFacts export() {
        requireLoaded();
        return new GraphFacts(topology.workflow(), new ArrayList<>(marking.facts()));
    }

    /**
     * Validate a delta against a snapshot: every removal exists, every added
     * fact lands on a free slot, every status change is a legal transition.
     *
     * @throws StructuralException naming the first offending node
     */
    public static void check(Snapshot snapshot, Delta delta) {
        Marking current = snapshot.marking();
        Set<String> freed = new HashSet<>();

        for (Fact removed : delta.removals()) {
            if (!current.contains(removed)) {
                throw new StructuralException(removed.nodeId(), "Cannot remove missing fact " + removed);
            }
            freed.add(removed.key());
        }

        Map<String, Fact> claimed = new HashMap<>();
        for (Fact added : delta.additions()) {
            if (!snapshot.topology().hasNode(added.nodeId())) {
                throw new StructuralException(added.nodeId(), "Fact " + added + " refers to an unknown node");
            }
            Fact other = claimed.put(added.key(), added);
            if (other != null) {
                throw new StructuralException(added.nodeId(),
                        "Conflicting additions for slot " + added.key() + ": " + other + " and " + added);
            }
            boolean occupied = current.bySlot(added.key()).isPresent() && !freed.contains(added.key());
            if (occupied) {
                throw new StructuralException(added.nodeId(), "Slot " + added.key() + " is already occupied");
            }
            if (added instanceof StatusFact) {
                StatusFact status = (StatusFact) added;
                NodeRef ref = status.ref();
                NodeStatus from = current.status(ref);
                if (!from.canTransitionTo(status.status())) {
                    throw new StructuralException(ref.nodeId(),
                            "Illegal transition " + from + " -> " + status.status() + " for " + ref);
                }
            }
        }
    }

    private void requireLoaded() {
        if (topology == null) {
            throw new IllegalStateException("No topology loaded");
        }
    }

    public List<Fact> facts() {
        return List.copyOf(marking.facts());
    }
}
