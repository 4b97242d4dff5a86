package org.neuralchilli.tickflow.store;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.domain.SignalKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable set of facts, indexed by fact key. One marking is one generation
 * of the store.
 */
public final class Marking {

    private static final Marking EMPTY = new Marking(new TreeMap<>());

    private final SortedMap<String, Fact> facts;
    private final Map<NodeRef, NodeStatus> statuses;
    private final Set<NodeRef> tokens;

    private Marking(SortedMap<String, Fact> facts) {
        this.facts = Collections.unmodifiableSortedMap(facts);

        Map<NodeRef, NodeStatus> statusIndex = new TreeMap<>(NodeRef.ORDER);
        Set<NodeRef> tokenIndex = new TreeSet<>(NodeRef.ORDER);
        for (Fact fact : facts.values()) {
            if (fact instanceof StatusFact) {
                StatusFact status = (StatusFact) fact;
                statusIndex.put(status.ref(), status.status());
            } else if (fact instanceof TokenFact) {
                tokenIndex.add(((TokenFact) fact).ref());
            }
        }
        this.statuses = Collections.unmodifiableMap(statusIndex);
        this.tokens = Collections.unmodifiableSet(tokenIndex);
    }

    public static Marking empty() {
        return EMPTY;
    }

    /**
     * Build a marking from loose facts
     *
     * @throws IllegalArgumentException if two facts occupy the same slot
     */
    public static Marking of(Collection<? extends Fact> facts) {
        SortedMap<String, Fact> index = new TreeMap<>();
        for (Fact fact : facts) {
            Fact previous = index.put(fact.key(), fact);
            if (previous != null && !previous.equals(fact)) {
                throw new IllegalArgumentException(
                        "Conflicting facts for slot " + fact.key() + ": " + previous + " and " + fact
                );
            }
        }
        return new Marking(index);
    }

    /**
     * Produce the next generation. Callers validate first; this method only
     * enforces slot uniqueness.
     */
    Marking apply(Delta delta) {
        SortedMap<String, Fact> next = new TreeMap<>(facts);
        for (Fact removed : delta.removals()) {
            next.remove(removed.key(), removed);
        }
        for (Fact added : delta.additions()) {
            next.put(added.key(), added);
        }
        return new Marking(next);
    }

    public Collection<Fact> facts() {
        return facts.values();
    }

    public boolean contains(Fact fact) {
        return fact.equals(facts.get(fact.key()));
    }

    public Optional<Fact> bySlot(String key) {
        return Optional.ofNullable(facts.get(key));
    }

    public NodeStatus status(NodeRef ref) {
        return statuses.getOrDefault(ref, NodeStatus.PENDING);
    }

    public Map<NodeRef, NodeStatus> statuses() {
        return statuses;
    }

    public boolean hasToken(NodeRef ref) {
        return tokens.contains(ref);
    }

    public Set<NodeRef> tokenRefs() {
        return tokens;
    }

    public int tokenCount() {
        return tokens.size();
    }

    public List<ArrivalFact> arrivals(String target) {
        return ofType(ArrivalFact.class).stream()
                .filter(a -> a.target().equals(target))
                .toList();
    }

    public List<ArrivalFact> allArrivals() {
        return ofType(ArrivalFact.class);
    }

    public Optional<JoinState> joinState(String nodeId) {
        return bySlot("join:" + nodeId).map(f -> ((JoinFact) f).state());
    }

    public Optional<MultiInstanceGroup> group(String nodeId) {
        return bySlot("group:" + nodeId).map(f -> ((GroupFact) f).group());
    }

    public boolean hasMarker(String nodeId, MarkerKind kind) {
        return facts.containsKey(new MarkerFact(nodeId, kind).key());
    }

    /**
     * Pending signals for a node, earliest delivered first
     */
    public List<SignalFact> signals(String nodeId) {
        return ofType(SignalFact.class).stream()
                .filter(s -> s.nodeId().equals(nodeId))
                .sorted(SignalFact.ARRIVAL_ORDER)
                .toList();
    }

    public Optional<SignalFact> signal(String nodeId, SignalKind kind) {
        return signals(nodeId).stream()
                .filter(s -> s.kind() == kind)
                .findFirst();
    }

    /**
     * Branches a multi-choice activated towards this join and not yet merged
     */
    public List<BranchFact> branches(String join) {
        return ofType(BranchFact.class).stream()
                .filter(b -> b.join().equals(join))
                .toList();
    }

    public Optional<LockFact> lock(String lock) {
        return bySlot("lock:" + lock).map(LockFact.class::cast);
    }

    public List<LockFact> locksHeldBy(NodeRef holder) {
        return ofType(LockFact.class).stream()
                .filter(l -> l.holder().equals(holder))
                .toList();
    }

    public int visits(String nodeId) {
        return bySlot("visit:" + nodeId).map(f -> ((VisitFact) f).count()).orElse(0);
    }

    public Map<String, Integer> allVisits() {
        Map<String, Integer> result = new TreeMap<>();
        for (VisitFact visit : ofType(VisitFact.class)) {
            result.put(visit.nodeId(), visit.count());
        }
        return result;
    }

    public <T extends Fact> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Fact fact : facts.values()) {
            if (type.isInstance(fact)) {
                result.add(type.cast(fact));
            }
        }
        return result;
    }

    public int size() {
        return facts.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        return facts.equals(((Marking) obj).facts);
    }

    @Override
    public int hashCode() {
        return facts.hashCode();
    }

    @Override
    public String toString() {
        return "Marking[facts=" + facts.size() + ", tokens=" + tokens + ']';
    }
}
