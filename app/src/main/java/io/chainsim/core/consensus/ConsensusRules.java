package io.chainsim.core.consensus;

import io.chainsim.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class ConsensusRules {
    private ConsensusRules() {}

    /** True iff {@code candidate} sits exactly one above {@code tip} and names it as parent. */
    public static boolean extendsTip(Block tip, Block candidate) {
        if (tip == null || candidate == null) return false;
        if (candidate.height() != tip.height() + 1) return false;
        return Objects.equals(candidate.parentId(), tip.id());
    }

    /**
     * Proposals at {@code height}, in proposal order.
     * Only the height is compared: a candidate built on a different parent still passes and is
     * left for the append guard to reject.
     */
    public static List<Block> candidatesAt(List<Block> proposals, long height) {
        List<Block> out = new ArrayList<>();
        for (Block b : proposals) {
            if (b.height() == height) out.add(b);
        }
        return out;
    }
}
