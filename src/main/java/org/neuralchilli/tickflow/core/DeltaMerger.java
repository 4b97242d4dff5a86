package org.neuralchilli.tickflow.core;

import org.neuralchilli.tickflow.domain.NodeRef;
import org.neuralchilli.tickflow.domain.NodeStatus;
import org.neuralchilli.tickflow.service.StructuralException;
import org.neuralchilli.tickflow.store.Delta;
import org.neuralchilli.tickflow.store.Fact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.neuralchilli.tickflow.store.StatusFact;
import org.neuralchilli.tickflow.store.TokenFact;
import org.neuralchilli.tickflow.store.TopologyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds the contributions of one tick into a single delta.
 * <p>
 * Cancellations are merged first and always accepted. Every other
 * contribution is accepted only if none of the slots it touches has already
 * been claimed this tick; otherwise it is deferred and its subject retries
 * against the next snapshot. The result does not depend on scan order: the
 * fold runs in subject order and removals win over additions.
 */
public class DeltaMerger {

    private static final Logger log = LoggerFactory.getLogger(DeltaMerger.class);

    private static final Comparator<Contribution> BY_SUBJECT =
            Comparator.comparing(Contribution::subject, NodeRef.ORDER);

    public MergeOutcome merge(Snapshot snapshot, List<Contribution> contributions) {
        List<Contribution> ordered = new ArrayList<>();
        contributions.stream().filter(Contribution::isCancellation).sorted(BY_SUBJECT).forEach(ordered::add);
        contributions.stream().filter(c -> !c.isCancellation()).sorted(BY_SUBJECT).forEach(ordered::add);

        List<Contribution> accepted = new ArrayList<>();
        List<Contribution> deferred = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Contribution> claimedBy = new HashMap<>();

        for (Contribution contribution : ordered) {
            if (contribution.delta().isEmpty()) {
                continue;
            }
            String nodeId = contribution.subject().nodeId();
            try {
                TopologyStore.check(snapshot, contribution.delta());
            } catch (StructuralException e) {
                log.warn("Skipping {}: {}", contribution, e.getMessage());
                diagnostics.add(new Diagnostic(DiagnosticKind.STRUCTURAL,
                        e.getNodeId() != null ? e.getNodeId() : nodeId, e.getMessage()));
                continue;
            }

            Set<String> claims = contribution.claims();
            if (!contribution.isCancellation()) {
                Contribution owner = firstOwner(claims, claimedBy);
                if (owner != null) {
                    deferred.add(contribution);
                    diagnostics.add(conflict(contribution, owner));
                    continue;
                }
            }
            accepted.add(contribution);
            for (String key : claims) {
                claimedBy.putIfAbsent(key, contribution);
            }
        }

        Delta merged = settle(snapshot, Delta.union(accepted.stream().map(Contribution::delta).toList()),
                diagnostics);
        return new MergeOutcome(merged, accepted, deferred, diagnostics);
    }

    private Contribution firstOwner(Set<String> claims, Map<String, Contribution> claimedBy) {
        for (String key : claims) {
            Contribution owner = claimedBy.get(key);
            if (owner != null) {
                return owner;
            }
        }
        return null;
    }

    private Diagnostic conflict(Contribution loser, Contribution owner) {
        String nodeId = loser.subject().nodeId();
        if (owner.isCancellation()) {
            log.warn("Cancellation {} overrides {} on {}", owner.label(), loser.label(), loser.subject());
            return new Diagnostic(DiagnosticKind.CANCELLATION_CONFLICT, nodeId,
                    owner.label() + "@" + owner.subject() + " cancelled " + loser.label() + "@" + loser.subject());
        }
        log.debug("{} deferred: work already taken by {}", loser, owner);
        return new Diagnostic(DiagnosticKind.CONTESTED_CONSUMPTION, nodeId,
                loser.label() + "@" + loser.subject() + " deferred behind " + owner.label() + "@" + owner.subject());
    }

    /**
     * Cancellations may overlap each other. Keep one status per ref, the one
     * with the highest precedence, and drop tokens placed on refs being voided.
     */
    private Delta settle(Snapshot snapshot, Delta merged, List<Diagnostic> diagnostics) {
        Map<NodeRef, StatusFact> statuses = new HashMap<>();
        Set<Fact> additions = new LinkedHashSet<>();
        for (Fact fact : merged.additions()) {
            if (fact instanceof StatusFact) {
                StatusFact status = (StatusFact) fact;
                StatusFact other = statuses.get(status.ref());
                if (other == null) {
                    statuses.put(status.ref(), status);
                } else {
                    StatusFact winner = status.status().precedence() > other.status().precedence() ? status : other;
                    statuses.put(status.ref(), winner);
                    diagnostics.add(new Diagnostic(DiagnosticKind.CANCELLATION_CONFLICT, status.ref().nodeId(),
                            "Status of " + status.ref() + " settled to " + winner.status()));
                }
                continue;
            }
            additions.add(fact);
        }
        additions.removeIf(f -> f instanceof TokenFact
                && voided(statuses.get(((TokenFact) f).ref())));
        additions.addAll(statuses.values().stream()
                .sorted(Comparator.comparing(StatusFact::ref, NodeRef.ORDER))
                .toList());

        Delta settled = new Delta(additions, merged.removals());
        if (settled.size() != merged.size()) {
            log.debug("Merged delta settled from {} to {} changes at generation {}",
                    merged.size(), settled.size(), snapshot.generation());
        }
        return settled;
    }

    private boolean voided(StatusFact status) {
        return status != null && status.status() == NodeStatus.VOIDED;
    }
}
