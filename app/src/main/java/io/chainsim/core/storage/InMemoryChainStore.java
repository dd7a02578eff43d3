package io.chainsim.core.storage;

import io.chainsim.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store backed by an {@link ArrayList}.
 * Tip access, append and removal are O(1).
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    @Override
    public void append(Block block) {
        if (block == null) throw new IllegalArgumentException("null block");
        blocks.add(block);
    }

    @Override
    public Optional<Block> removeTip() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.remove(blocks.size() - 1));
    }

    @Override
    public Optional<Block> getTip() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(blocks.get(blocks.size() - 1));
    }

    @Override
    public int size() {
        return blocks.size();
    }

    @Override
    public List<Block> getBlocksInOrder() {
        return List.copyOf(blocks);
    }
}
