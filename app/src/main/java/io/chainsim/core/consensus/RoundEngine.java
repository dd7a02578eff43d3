package io.chainsim.core.consensus;

import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs one consensus round over an ordered list of nodes, mutating them in place.
 *
 * Phases, each finished before the next starts:
 * 1) propose: every node builds a block on its own tip
 * 2) select-or-correct: every node appends a random proposal at its next height, or discards
 *    its tip when there is none and some node is already higher
 * 3) aggregate: majority height, then majority tip id at that height (first seen wins ties)
 * 4) reconcile: lagging or conflicting nodes adopt the majority block
 *
 * Node order matters for tie-breaks and for what phase 2 sees, so callers pass a List.
 * Not thread-safe; rounds must run one at a time.
 */
public final class RoundEngine {
    private static final Logger LOG = Logger.getLogger(RoundEngine.class.getName());

    private final RandomSource random;
    private final boolean adoptMajority;

    public RoundEngine(RandomSource random) {
        this(random, true);
    }

    /** @param adoptMajority false skips phase 4, leaving forks in place after the tally */
    public RoundEngine(RandomSource random, boolean adoptMajority) {
        if (random == null) throw new IllegalArgumentException("random source required");
        this.random = random;
        this.adoptMajority = adoptMajority;
    }

    public RoundResult runRound(List<Node> nodes) {
        List<RoundEvent> events = new ArrayList<>();

        List<Block> proposals = propose(nodes);
        selectOrCorrect(nodes, proposals, events);

        Optional<MajorityTally> tally = MajorityTally.of(nodes);
        if (tally.isEmpty()) {
            return new RoundResult(proposals, null, null, events);
        }
        MajorityTally majority = tally.get();
        LOG.fine(() -> "Round tally " + majority);
        if (!adoptMajority) {
            return new RoundResult(proposals, majority, null, events);
        }

        Optional<Block> reference = majority.findReference(nodes);
        if (reference.isEmpty()) {
            return new RoundResult(proposals, majority, null, events);
        }
        reconcile(nodes, majority, reference.get(), events);
        return new RoundResult(proposals, majority, reference.get(), events);
    }

    private List<Block> propose(List<Node> nodes) {
        List<Block> proposals = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            proposals.add(node.propose(random));
        }
        return proposals;
    }

    private void selectOrCorrect(List<Node> nodes, List<Block> proposals, List<RoundEvent> events) {
        for (Node node : nodes) {
            long height = node.height();
            List<Block> candidates = ConsensusRules.candidatesAt(proposals, height + 1);
            if (!candidates.isEmpty()) {
                Block chosen = random.pick(candidates);
                if (!node.append(chosen)) {
                    events.add(new RoundEvent(RoundEvent.Kind.SELECTION_REJECTED,
                            node.nodeId(), height, height, chosen.id()));
                }
                continue;
            }
            // read live: nodes earlier in this loop may already have grown
            long networkHeight = maxHeight(nodes);
            if (networkHeight > height && node.rollback()) {
                events.add(new RoundEvent(RoundEvent.Kind.SELF_CORRECTED,
                        node.nodeId(), height, node.height(), null));
            }
        }
    }

    private static void reconcile(List<Node> nodes, MajorityTally majority, Block reference,
                                  List<RoundEvent> events) {
        long majorityHeight = majority.majorityHeight();
        for (Node node : nodes) {
            long before = node.height();
            if (before < majorityHeight) {
                // only reachable at the boundary; kept so the catch-up path mirrors the reorg path
                while (node.height() >= majorityHeight && node.length() > 1) {
                    node.rollback();
                }
                if (adopt(node, reference)) {
                    events.add(new RoundEvent(RoundEvent.Kind.ADOPTED,
                            node.nodeId(), before, node.height(), reference.id()));
                }
            } else if (before == majorityHeight && !node.tip().id().equals(majority.majorityHash())) {
                node.rollback();
                adopt(node, reference);
                events.add(new RoundEvent(RoundEvent.Kind.REORGED,
                        node.nodeId(), before, node.height(), reference.id()));
            }
        }
    }

    /** Appends a copy of {@code reference} re-parented onto the node's tip, if heights line up. */
    private static boolean adopt(Node node, Block reference) {
        if (node.height() + 1 != reference.height()) return false;
        return node.append(Block.adopt(reference, node.tip().id()));
    }

    private static long maxHeight(List<Node> nodes) {
        long max = Long.MIN_VALUE;
        for (Node node : nodes) {
            max = Math.max(max, node.height());
        }
        return max;
    }
}
