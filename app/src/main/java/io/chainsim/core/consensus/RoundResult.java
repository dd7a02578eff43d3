package io.chainsim.core.consensus;

import io.chainsim.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/** What one call to {@link RoundEngine#runRound(List)} saw and did. */
public final class RoundResult {
    private final List<Block> proposals;
    private final MajorityTally tally;   // null when there were no nodes
    private final Block reference;       // null when reconciliation did not run
    private final List<RoundEvent> events;

    RoundResult(List<Block> proposals, MajorityTally tally, Block reference, List<RoundEvent> events) {
        this.proposals = List.copyOf(proposals);
        this.tally = tally;
        this.reference = reference;
        this.events = List.copyOf(events);
    }

    /** Phase-1 proposals, one per node entry, in node order. */
    public List<Block> proposals() { return proposals; }

    public Optional<MajorityTally> tally() { return Optional.ofNullable(tally); }

    /** Block the lagging nodes were reconciled against. */
    public Optional<Block> reference() { return Optional.ofNullable(reference); }

    /** Events in the order they happened. */
    public List<RoundEvent> events() { return events; }

    public long count(RoundEvent.Kind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }
}
