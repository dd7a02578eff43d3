package io.chainsim.core.consensus;

import java.util.List;

/**
 * Randomness used by a simulation: block identifiers and phase-2 candidate selection.
 * Injected so that runs can be replayed from a seed.
 */
public interface RandomSource {

    /** A fresh block identifier. */
    String nextBlockId();

    /** Uniform index in {@code [0, bound)}. {@code bound} is positive. */
    int nextIndex(int bound);

    /** Picks one element uniformly at random. Every candidate has equal probability. */
    default <T> T pick(List<T> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("no candidates to pick from");
        }
        return candidates.get(nextIndex(candidates.size()));
    }

    /** Reproducible source: the same seed yields the same ids and picks. */
    static RandomSource seeded(long seed) {
        return new SeededRandomSource(seed);
    }

    /** Unseeded source backed by a fresh {@link java.security.SecureRandom}-seeded generator. */
    static RandomSource system() {
        return new SeededRandomSource(new java.security.SecureRandom().nextLong());
    }
}
