package io.chainsim.core.node;

import io.chainsim.core.protocol.Block;
import io.chainsim.core.storage.ChainStore;

/**
 * Creates the genesis block every chain starts from.
 * - Height = 0
 * - no parent
 * - id = {@link io.chainsim.core.protocol.BlockIds#GENESIS_ID}, identical across nodes and runs
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    /** Build a fresh clone of the shared genesis block. */
    public static Block buildGenesis() {
        return Block.genesis();
    }

    /**
     * If the chain is empty, store a genesis clone.
     * Idempotent: does nothing if a tip already exists.
     */
    public static void initIfNeeded(ChainStore chain) {
        if (chain.getTip().isPresent()) return;
        chain.append(buildGenesis());
    }
}
