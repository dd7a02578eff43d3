package io.chainsim.core.consensus;

import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.Block;
import io.chainsim.core.protocol.BlockIds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Height and tip-id counts for one round, built fresh from the nodes' current state.
 *
 * Ties are broken by node order: of the values reaching the highest count, the one first seen
 * while scanning the nodes wins. The counts are kept in {@link LinkedHashMap}s so that
 * insertion order is exactly that scan order.
 */
public final class MajorityTally {
    private final Map<Long, Integer> heightCounts;
    private final Map<String, Integer> hashCounts;
    private final long majorityHeight;
    private final String majorityHash;

    private MajorityTally(Map<Long, Integer> heightCounts, Map<String, Integer> hashCounts,
                          long majorityHeight, String majorityHash) {
        this.heightCounts = Collections.unmodifiableMap(heightCounts);
        this.hashCounts = Collections.unmodifiableMap(hashCounts);
        this.majorityHeight = majorityHeight;
        this.majorityHash = majorityHash;
    }

    /** Tally over {@code nodes}, or empty when there are no nodes. */
    public static Optional<MajorityTally> of(List<Node> nodes) {
        Map<Long, Integer> heights = new LinkedHashMap<>();
        for (Node node : nodes) {
            heights.merge(node.height(), 1, Integer::sum);
        }
        if (heights.isEmpty()) return Optional.empty();
        long majorityHeight = firstMaximum(heights);

        Map<String, Integer> hashes = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (node.height() == majorityHeight) {
                hashes.merge(node.tip().id(), 1, Integer::sum);
            }
        }
        String majorityHash = firstMaximum(hashes);
        return Optional.of(new MajorityTally(heights, hashes, majorityHeight, majorityHash));
    }

    /** Key with the highest count; among equal counts, the earliest inserted key. */
    static <K> K firstMaximum(Map<K, Integer> counts) {
        K best = null;
        int bestCount = 0;
        for (Map.Entry<K, Integer> e : counts.entrySet()) {
            // strict comparison keeps the earlier key on a tie
            if (best == null || e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    /** Tip of the first node (in order) at the majority height carrying the majority hash. */
    public Optional<Block> findReference(List<Node> nodes) {
        for (Node node : nodes) {
            if (node.height() == majorityHeight && node.tip().id().equals(majorityHash)) {
                return Optional.of(node.tip());
            }
        }
        return Optional.empty();
    }

    public long majorityHeight() { return majorityHeight; }
    public String majorityHash() { return majorityHash; }

    /** Height -> number of nodes, in first-seen order. */
    public Map<Long, Integer> heightCounts() { return heightCounts; }

    /** Tip id -> number of nodes at the majority height, in first-seen order. */
    public Map<String, Integer> hashCounts() { return hashCounts; }

    @Override public String toString() {
        return "MajorityTally{height=" + majorityHeight + ", hash=" + BlockIds.shorten(majorityHash)
                + ", heights=" + heightCounts + "}";
    }
}
