package io.chainsim.core.consensus;

import io.chainsim.core.protocol.BlockIds;

/**
 * Something worth reporting that happened to one node during a round.
 * Events are informational; none of them is a failure.
 *
 * @param kind       what happened
 * @param nodeId     node it happened to
 * @param fromHeight node height before the change
 * @param toHeight   node height after the change
 * @param blockId    block involved (selected or adopted), or null
 */
public record RoundEvent(Kind kind, int nodeId, long fromHeight, long toHeight, String blockId) {

    public enum Kind {
        /** Phase 2 picked a candidate whose parent is not the node's tip; the node did not grow. */
        SELECTION_REJECTED,
        /** Phase 2 found no candidate while the network was higher; the tip was discarded. */
        SELF_CORRECTED,
        /** Phase 4: a node below the majority height appended the majority block. */
        ADOPTED,
        /** Phase 4: a node at the majority height on another tip dropped it for the majority block. */
        REORGED
    }

    public String describe() {
        switch (kind) {
            case SELECTION_REJECTED:
                return "Node " + nodeId + " selected " + BlockIds.shorten(blockId)
                        + " which does not extend its tip, staying at height " + toHeight;
            case SELF_CORRECTED:
                return "Node " + nodeId + " discarding last block (behind network: height "
                        + fromHeight + " -> " + toHeight + ")";
            case ADOPTED:
                return "Node " + nodeId + " caught up to majority block " + BlockIds.shorten(blockId)
                        + " (height " + fromHeight + " -> " + toHeight + ")";
            case REORGED:
                return "Node " + nodeId + " was on a different hash at majority height " + fromHeight
                        + ", adopting majority " + BlockIds.shorten(blockId);
            default:
                throw new IllegalStateException("unknown kind " + kind);
        }
    }
}
