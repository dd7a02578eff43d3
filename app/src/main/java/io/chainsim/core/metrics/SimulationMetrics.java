package io.chainsim.core.metrics;

import io.chainsim.core.consensus.RoundEvent;
import io.chainsim.core.consensus.RoundResult;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class SimulationMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter roundsCompleted = registry.counter("rounds.completed");
    private static final Timer roundTime = registry.timer("round.time");
    private static final Counter selfCorrections = Counter.builder("node.self_corrections")
            .description("Tips discarded because the node fell behind the network")
            .register(registry);
    private static final Counter rejectedSelections = Counter.builder("node.selections.rejected")
            .description("Selected proposals that did not extend the selecting node's tip")
            .register(registry);
    private static final Counter adoptions = Counter.builder("node.adoptions")
            .description("Majority blocks appended by nodes below the majority height")
            .register(registry);
    private static final Counter reorgs = Counter.builder("node.reorgs")
            .description("Conflicting tips replaced by the majority block")
            .register(registry);

    public static <T> T recordRound(Supplier<T> roundLogic) {
        return roundTime.record(roundLogic);
    }

    /** Count the round and each of its events. */
    public static void recordOutcome(RoundResult result) {
        roundsCompleted.increment();
        for (RoundEvent event : result.events()) {
            counterFor(event.kind()).increment();
        }
    }

    private static Counter counterFor(RoundEvent.Kind kind) {
        switch (kind) {
            case SELF_CORRECTED: return selfCorrections;
            case SELECTION_REJECTED: return rejectedSelections;
            case ADOPTED: return adoptions;
            case REORGED: return reorgs;
            default: throw new IllegalArgumentException("unknown event kind " + kind);
        }
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
