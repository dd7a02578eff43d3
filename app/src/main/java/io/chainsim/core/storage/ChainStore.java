package io.chainsim.core.storage;

import io.chainsim.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Ordered block list owned by a single node.
 * Index 0 is the oldest block; the last element is the tip.
 *
 * Notes:
 * - The store does not validate linkage; callers decide what may be appended.
 * - There is no branch bookkeeping: a reorg is a sequence of removeTip() calls followed by appends.
 */
public interface ChainStore {

    /** Add a block on top of the current tip. */
    void append(Block block);

    /** Remove and return the tip, or empty if the store holds no blocks. */
    Optional<Block> removeTip();

    /** Current tip if any block is stored. */
    Optional<Block> getTip();

    /** Number of blocks stored. */
    int size();

    /** Immutable copy of the stored blocks, oldest first. */
    List<Block> getBlocksInOrder();

    default boolean isEmpty() {
        return size() == 0;
    }
}
