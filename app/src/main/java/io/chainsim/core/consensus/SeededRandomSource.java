package io.chainsim.core.consensus;

import io.chainsim.core.protocol.BlockIds;

import java.util.Random;

/** {@link RandomSource} over a single {@link Random}; ids and picks share one stream. */
final class SeededRandomSource implements RandomSource {
    private final long seed;
    private final Random rnd;

    SeededRandomSource(long seed) {
        this.seed = seed;
        this.rnd = new Random(seed);
    }

    @Override
    public String nextBlockId() {
        return BlockIds.randomId(rnd);
    }

    @Override
    public int nextIndex(int bound) {
        if (bound <= 0) throw new IllegalArgumentException("bound must be positive: " + bound);
        return rnd.nextInt(bound);
    }

    @Override public String toString() {
        return "SeededRandomSource{seed=" + seed + "}";
    }
}
