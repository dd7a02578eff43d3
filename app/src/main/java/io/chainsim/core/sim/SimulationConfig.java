package io.chainsim.core.sim;

import io.chainsim.core.protocol.BlockIds;

/** Simple config holder for one simulation run. */
public final class SimulationConfig {
    public final int nodeCount;
    public final int rounds;
    public final Long seed;              // null = unseeded
    public final int hashPrefixLength;
    public final boolean adoptMajority;
    public final boolean printChains;

    public SimulationConfig(int nodeCount, int rounds, Long seed, int hashPrefixLength,
                            boolean adoptMajority, boolean printChains) {
        if (nodeCount <= 0) throw new IllegalArgumentException("node count must be positive: " + nodeCount);
        if (rounds < 0) throw new IllegalArgumentException("round count must not be negative: " + rounds);
        if (hashPrefixLength < 1) throw new IllegalArgumentException("hash prefix length must be positive: " + hashPrefixLength);
        this.nodeCount = nodeCount;
        this.rounds = rounds;
        this.seed = seed;
        this.hashPrefixLength = hashPrefixLength;
        this.adoptMajority = adoptMajority;
        this.printChains = printChains;
    }

    public static SimulationConfig defaultLocal() {
        return new SimulationConfig(
                5,                         // nodes
                5,                         // rounds
                null,                      // fresh randomness each run
                BlockIds.DISPLAY_LENGTH,   // hash prefix in reports
                true,                      // run the adoption pass
                true                       // log every node's chain after each round
        );
    }

    public SimulationConfig withSize(int nodeCount, int rounds) {
        return new SimulationConfig(nodeCount, rounds, seed, hashPrefixLength, adoptMajority, printChains);
    }

    public SimulationConfig withSeed(Long seed) {
        return new SimulationConfig(nodeCount, rounds, seed, hashPrefixLength, adoptMajority, printChains);
    }

    public SimulationConfig withAdoptMajority(boolean adoptMajority) {
        return new SimulationConfig(nodeCount, rounds, seed, hashPrefixLength, adoptMajority, printChains);
    }

    public SimulationConfig withPrintChains(boolean printChains) {
        return new SimulationConfig(nodeCount, rounds, seed, hashPrefixLength, adoptMajority, printChains);
    }
}
