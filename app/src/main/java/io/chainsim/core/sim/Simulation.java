package io.chainsim.core.sim;

import io.chainsim.core.consensus.RandomSource;
import io.chainsim.core.consensus.RoundEngine;
import io.chainsim.core.consensus.RoundEvent;
import io.chainsim.core.consensus.RoundResult;
import io.chainsim.core.metrics.SimulationMetrics;
import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.Block;
import io.chainsim.core.report.RoundRecorder;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Wires nodes, the round engine and the recorder.
 * Build once, then call {@link #run()} or {@link #runRound()} repeatedly.
 */
public final class Simulation {
    private static final Logger LOG = Logger.getLogger(Simulation.class.getName());

    private final SimulationConfig config;
    private final List<Node> nodes;
    private final RoundEngine engine;
    private final RoundRecorder recorder;
    private int nextRound;

    public Simulation(SimulationConfig config, RandomSource random) {
        this.config = config;
        this.nodes = new ArrayList<>(config.nodeCount);
        for (int i = 0; i < config.nodeCount; i++) {
            nodes.add(Node.create(i));
        }
        this.engine = new RoundEngine(random, config.adoptMajority);
        this.recorder = new RoundRecorder(config.hashPrefixLength);
    }

    /** Seeded when the config carries a seed, unseeded otherwise. */
    public static Simulation fromConfig(SimulationConfig config) {
        RandomSource random = config.seed != null ? RandomSource.seeded(config.seed) : RandomSource.system();
        return new Simulation(config, random);
    }

    /** Run all configured rounds; returns the recorder holding every round's records. */
    public RoundRecorder run() {
        for (int r = 0; r < config.rounds; r++) {
            runRound();
        }
        return recorder;
    }

    /** Run the next round, record and report it. */
    public RoundResult runRound() {
        int round = nextRound++;
        RoundResult result = SimulationMetrics.recordRound(() -> engine.runRound(nodes));
        SimulationMetrics.recordOutcome(result);
        recorder.record(round, nodes);

        for (RoundEvent event : result.events()) {
            LOG.info(event::describe);
        }
        if (config.printChains) {
            LOG.info("=== Round " + round + " ===");
            for (Node node : nodes) {
                LOG.info(() -> describe(node));
            }
        }
        return result;
    }

    static String describe(Node node) {
        String chain = node.chain().stream().map(Block::toString).collect(Collectors.joining(", ", "[", "]"));
        return "Node " + node.nodeId() + " | height=" + node.height() + " | chain=" + chain;
    }

    /** Nodes in their fixed order. Mutating them outside a round is the caller's business. */
    public List<Node> nodes() {
        return List.copyOf(nodes);
    }

    public RoundRecorder recorder() {
        return recorder;
    }

    public int roundsRun() {
        return nextRound;
    }
}
