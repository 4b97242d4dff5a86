package org.neuralchilli.tickflow.monitoring;

import org.neuralchilli.tickflow.core.Contribution;
import org.neuralchilli.tickflow.core.TickListener;
import org.neuralchilli.tickflow.core.TickResult;
import org.neuralchilli.tickflow.store.Fact;
import org.neuralchilli.tickflow.store.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps the history of a run: one record and one receipt per tick, plus
 * firing counts per pattern. Receipts form a hash chain over the marking, so
 * a replay of the same case yields the same chain.
 */
public class ProvenanceRecorder implements TickListener {

    private static final Logger log = LoggerFactory.getLogger(ProvenanceRecorder.class);

    private final List<ProvenanceRecord> history = new ArrayList<>();
    private final List<Receipt> receipts = new ArrayList<>();
    private final Map<String, Long> patternCounts = new TreeMap<>();
    private final Map<Long, Integer> firedThisTick = new TreeMap<>();
    private long tickStartedAt;

    @Override
    public boolean onPreTick(long tickNumber, Snapshot snapshot) {
        tickStartedAt = System.nanoTime();
        return true;
    }

    @Override
    public void onPatternFired(long tickNumber, Contribution contribution) {
        patternCounts.merge(contribution.label(), 1L, Long::sum);
        firedThisTick.merge(tickNumber, 1, Integer::sum);
    }

    @Override
    public void onPostTick(TickResult result, Snapshot after) {
        int fired = firedThisTick.getOrDefault(result.tickNumber(), 0);
        firedThisTick.remove(result.tickNumber());
        history.add(new ProvenanceRecord(result.tickNumber(), fired, result.deltaSize(),
                System.nanoTime() - tickStartedAt));

        String previous = receipts.isEmpty() ? "" : receipts.get(receipts.size() - 1).hash();
        String state = stateHash(after);
        Receipt receipt = new Receipt(result.tickNumber(), state, previous,
                sha256(result.tickNumber() + "|" + state + "|" + previous));
        receipts.add(receipt);
        log.trace("Tick {} receipt {}", result.tickNumber(), receipt.hash());
    }

    public List<ProvenanceRecord> history() {
        return List.copyOf(history);
    }

    public List<Receipt> receipts() {
        return List.copyOf(receipts);
    }

    public Map<String, Long> patternCounts() {
        return Map.copyOf(patternCounts);
    }

    public ProvenanceStatistics statistics() {
        if (history.isEmpty()) {
            return ProvenanceStatistics.EMPTY;
        }
        int ticks = history.size();
        long fired = history.stream().mapToLong(ProvenanceRecord::patternsFired).sum();
        long changes = history.stream().mapToLong(ProvenanceRecord::deltaSize).sum();

        Map.Entry<String, Long> most = patternCounts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .orElse(null);

        return new ProvenanceStatistics(
                ticks,
                fired,
                (double) fired / ticks,
                (double) changes / ticks,
                most != null ? most.getKey() : null,
                most != null ? most.getValue() : 0
        );
    }

    /**
     * Check that every receipt links to its predecessor and hashes correctly
     */
    public boolean verifyChain() {
        String previous = "";
        for (Receipt receipt : receipts) {
            if (!receipt.previousHash().equals(previous)) {
                return false;
            }
            String expected = sha256(receipt.tickNumber() + "|" + receipt.stateHash() + "|" + previous);
            if (!expected.equals(receipt.hash())) {
                return false;
            }
            previous = receipt.hash();
        }
        return true;
    }

    public void clear() {
        history.clear();
        receipts.clear();
        patternCounts.clear();
        firedThisTick.clear();
    }

    /**
     * Hash of the marking in slot order, independent of insertion order
     */
    static String stateHash(Snapshot snapshot) {
        StringBuilder canonical = new StringBuilder();
        snapshot.marking().facts().stream()
                .sorted(Comparator.comparing(Fact::key))
                .forEach(f -> canonical.append(f).append('\n'));
        return sha256(canonical.toString());
    }

    static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
