package io.chainsim.core.consensus;

import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.Block;
import io.chainsim.core.protocol.BlockIds;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static io.chainsim.core.consensus.MajorityTallyTest.nodeAt;
import static org.junit.jupiter.api.Assertions.*;

class RoundEngineTest {

    @Test
    void threeNodesConvergeOnMajorityPick() {
        Node a = Node.create(0);
        Node b = Node.create(1);
        Node c = Node.create(2);
        List<Node> nodes = List.of(a, b, c);
        // A and B pick X, C picks its own Z
        ScriptedRandomSource random = new ScriptedRandomSource().ids("X", "Y", "Z").picks(0, 0, 2);

        RoundResult result = new RoundEngine(random).runRound(nodes);

        assertEquals(List.of("X", "Y", "Z"), ids(result.proposals()));
        MajorityTally tally = result.tally().orElseThrow();
        assertEquals(Map.of(1L, 3), tally.heightCounts());
        assertEquals(List.of("X", "Z"), new ArrayList<>(tally.hashCounts().keySet()));
        assertEquals(1L, tally.majorityHeight());
        assertEquals("X", tally.majorityHash());
        assertEquals("X", result.reference().orElseThrow().id());

        for (Node node : nodes) {
            assertEquals(1, node.height());
            assertEquals("X", node.tip().id());
            assertEquals(BlockIds.GENESIS_ID, node.tip().parentId());
        }
        assertEquals(List.of(new RoundEvent(RoundEvent.Kind.REORGED, 2, 1, 1, "X")), result.events());
    }

    @Test
    void fiveNodesFromSameTipAllEndOnOneBlock() {
        for (long seed = 0; seed < 25; seed++) {
            List<Node> nodes = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                nodes.add(Node.create(i));
            }
            new RoundEngine(RandomSource.seeded(seed)).runRound(nodes);

            String tip = nodes.get(0).tip().id();
            for (Node node : nodes) {
                assertEquals(1, node.height(), "seed " + seed);
                assertEquals(tip, node.tip().id(), "seed " + seed);
            }
        }
    }

    @Test
    void selectingForeignProposalWastesTheTurn() {
        Node a = nodeAt(0, 1, "a");
        Node b = nodeAt(1, 1, "b");
        // both pick B's proposal; it only fits B
        ScriptedRandomSource random = new ScriptedRandomSource().ids("pa", "pb").picks(1, 1);

        RoundResult result = new RoundEngine(random).runRound(List.of(a, b));

        assertEquals(1, a.height());
        assertEquals("a", a.tip().id());
        assertEquals(2, b.height());
        assertEquals("pb", b.tip().id());
        assertEquals(List.of(new RoundEvent(RoundEvent.Kind.SELECTION_REJECTED, 0, 1, 1, "pb")), result.events());

        // heights tie 1:1, A was seen first
        MajorityTally tally = result.tally().orElseThrow();
        assertEquals(1L, tally.majorityHeight());
        assertEquals("a", tally.majorityHash());
        assertSame(a.tip(), result.reference().orElseThrow());
    }

    @Test
    void nodeWithoutCandidatesFallsBackWhenNetworkIsHigher() {
        Node a = Node.create(0);
        Node b = nodeAt(1, 2, "b2");
        // A is listed twice: its second turn finds nothing at height 2
        List<Node> nodes = List.of(a, a, b);
        ScriptedRandomSource random = new ScriptedRandomSource().ids("a1", "a1bis", "b3").picks(0, 0);

        RoundResult result = new RoundEngine(random).runRound(nodes);

        assertEquals(0, a.height());
        assertEquals(3, b.height());
        assertEquals(1, result.count(RoundEvent.Kind.SELF_CORRECTED));
        assertEquals(new RoundEvent(RoundEvent.Kind.SELF_CORRECTED, 0, 1, 0, null), result.events().get(0));

        MajorityTally tally = result.tally().orElseThrow();
        assertEquals(0L, tally.majorityHeight());
        assertEquals(BlockIds.GENESIS_ID, tally.majorityHash());
        // B is above the majority and left alone
        assertEquals("b3", b.tip().id());
    }

    @Test
    void noFallbackWhenNobodyIsHigher() {
        Node a = Node.create(0);
        List<Node> nodes = List.of(a, a);
        ScriptedRandomSource random = new ScriptedRandomSource().ids("p", "q").picks(0);

        RoundResult result = new RoundEngine(random).runRound(nodes);

        assertEquals(1, a.height());
        assertEquals("p", a.tip().id());
        assertEquals(0, result.count(RoundEvent.Kind.SELF_CORRECTED));
    }

    @Test
    void laggingNodeAdoptsWithLocalParent() {
        Node a = nodeAt(0, 1, "m");
        Node b = nodeAt(1, 1, "m");
        Node c = nodeAt(2, 1, "m");
        Node d = Node.create(3);
        List<Node> nodes = List.of(a, b, c, d);
        ScriptedRandomSource random = new ScriptedRandomSource().ids("pA", "pB", "pC", "pD").picks(0, 0, 0, 0);

        RoundResult result = new RoundEngine(random).runRound(nodes);

        for (Node node : nodes) {
            assertEquals(2, node.height());
            assertEquals("pA", node.tip().id());
        }
        // D grew its own pD first, then the majority block was spliced on top of it
        assertEquals("pD", d.tip().parentId());
        assertEquals("m", a.tip().parentId());
        assertEquals(List.of(new RoundEvent(RoundEvent.Kind.ADOPTED, 3, 1, 2, "pA")), result.events());
    }

    @Test
    void nodeAboveMajorityKeepsItsChain() {
        Node high = nodeAt(0, 3, "h3");
        Node x = Node.create(1);
        Node y = Node.create(2);
        ScriptedRandomSource random = new ScriptedRandomSource().ids("h4", "x1", "y1").picks(0, 0, 0);

        RoundResult result = new RoundEngine(random).runRound(List.of(high, x, y));

        assertEquals(4, high.height());
        assertEquals("h4", high.tip().id());
        assertEquals(1, x.height());
        assertEquals(1, y.height());
        assertEquals("x1", y.tip().id());
        assertEquals(1L, result.tally().orElseThrow().majorityHeight());
    }

    @Test
    void emptyRoundDoesNothing() {
        RoundResult result = new RoundEngine(new ScriptedRandomSource()).runRound(List.of());
        assertTrue(result.proposals().isEmpty());
        assertTrue(result.tally().isEmpty());
        assertTrue(result.reference().isEmpty());
        assertTrue(result.events().isEmpty());
    }

    @Test
    void adoptionCanBeSwitchedOff() {
        Node a = Node.create(0);
        Node b = Node.create(1);
        Node c = Node.create(2);
        ScriptedRandomSource random = new ScriptedRandomSource().ids("X", "Y", "Z").picks(0, 0, 2);

        RoundResult result = new RoundEngine(random, false).runRound(List.of(a, b, c));

        assertEquals("X", result.tally().orElseThrow().majorityHash());
        assertTrue(result.reference().isEmpty());
        assertEquals("Z", c.tip().id());
        assertTrue(result.events().isEmpty());
    }

    @Test
    void heightsDropByAtMostTwoPerRound() {
        RandomSource random = RandomSource.seeded(7L);
        RoundEngine engine = new RoundEngine(random);
        List<Node> nodes = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            nodes.add(Node.create(i));
        }
        // seed a fork so reconciliation has work to do
        nodes.get(0).append(Block.of(1, BlockIds.GENESIS_ID, "fork-a"));
        nodes.get(1).append(Block.of(1, BlockIds.GENESIS_ID, "fork-b"));

        for (int round = 0; round < 30; round++) {
            long[] before = new long[nodes.size()];
            for (int i = 0; i < nodes.size(); i++) {
                before[i] = nodes.get(i).height();
            }
            engine.runRound(nodes);
            for (int i = 0; i < nodes.size(); i++) {
                assertTrue(nodes.get(i).height() >= before[i] - 2, "round " + round + " node " + i);
                assertEquals(nodes.get(i).height() + 1, nodes.get(i).length());
            }
        }
    }

    @Test
    void requiresRandomSource() {
        assertThrows(IllegalArgumentException.class, () -> new RoundEngine(null));
    }

    private static List<String> ids(List<Block> blocks) {
        List<String> out = new ArrayList<>();
        for (Block b : blocks) out.add(b.id());
        return out;
    }
}
