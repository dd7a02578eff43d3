package io.chainsim.core.node;

import io.chainsim.core.consensus.ConsensusRules;
import io.chainsim.core.consensus.RandomSource;
import io.chainsim.core.protocol.Block;
import io.chainsim.core.storage.ChainStore;
import io.chainsim.core.storage.InMemoryChainStore;

import java.util.List;

/**
 * One simulated participant: a stable id and a local chain that starts at genesis.
 * The chain only changes through {@link #append(Block)} and {@link #rollback()}, and never loses
 * its genesis block.
 */
public final class Node {

    private final int nodeId;
    private final ChainStore chain;

    public Node(int nodeId, ChainStore chain) {
        this.nodeId = nodeId;
        this.chain = chain;
        GenesisBuilder.initIfNeeded(chain);
    }

    /** Convenience factory for an in-memory node holding only genesis. */
    public static Node create(int nodeId) {
        return new Node(nodeId, new InMemoryChainStore());
    }

    public int nodeId() { return nodeId; }

    /** Height of the tip. */
    public long height() {
        return tip().height();
    }

    /** Last block of the local chain. */
    public Block tip() {
        return chain.getTip().orElseThrow(() -> new IllegalStateException("chain lost its genesis block"));
    }

    /** Candidate next block on top of the current tip. Does not change the node. */
    public Block propose(RandomSource random) {
        Block latest = tip();
        return Block.create(latest.height() + 1, latest.id(), random);
    }

    /**
     * Append {@code block} if it extends the current tip (height + 1 and matching parent id).
     * A block that does not fit is ignored.
     *
     * @return whether the block was appended
     */
    public boolean append(Block block) {
        if (!ConsensusRules.extendsTip(tip(), block)) return false;
        chain.append(block);
        return true;
    }

    /**
     * Drop the tip unless only genesis is left.
     *
     * @return whether a block was removed
     */
    public boolean rollback() {
        if (chain.size() <= 1) return false;
        chain.removeTip();
        return true;
    }

    /** Number of blocks including genesis. */
    public int length() {
        return chain.size();
    }

    /** Snapshot of the chain, genesis first. */
    public List<Block> chain() {
        return chain.getBlocksInOrder();
    }

    @Override public String toString() {
        return "Node{id=" + nodeId + ", height=" + height() + ", tip=" + tip() + "}";
    }
}
