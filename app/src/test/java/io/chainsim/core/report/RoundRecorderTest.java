package io.chainsim.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.Block;
import io.chainsim.core.protocol.BlockIds;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoundRecorderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void recordsOneEntryPerNodeWithShortHash() {
        Node a = Node.create(0);
        Node b = Node.create(1);
        b.append(Block.of(1, BlockIds.GENESIS_ID, "abcdef0123"));

        RoundRecorder recorder = new RoundRecorder(6);
        List<RoundRecord> round0 = recorder.record(0, List.of(a, b));

        assertEquals(List.of(
                new RoundRecord(0, 0, 0, "000000"),
                new RoundRecord(0, 1, 1, "abcdef")), round0);
        assertEquals(round0, recorder.records());
    }

    @Test
    void writesSnakeCaseJsonArrayInRoundOrder() throws Exception {
        Node a = Node.create(0);
        RoundRecorder recorder = new RoundRecorder(4);
        recorder.record(0, List.of(a));
        a.append(Block.of(1, BlockIds.GENESIS_ID, "feedbeef"));
        recorder.record(1, List.of(a));

        Path out = tempDir.resolve("nested").resolve("consensus_data.json");
        recorder.writeTo(out);

        assertTrue(Files.exists(out));
        JsonNode json = mapper.readTree(out.toFile());
        assertTrue(json.isArray());
        assertEquals(2, json.size());
        JsonNode second = json.get(1);
        assertEquals(1, second.get("round").asInt());
        assertEquals(0, second.get("node_id").asInt());
        assertEquals(1, second.get("height").asLong());
        assertEquals("feed", second.get("hash").asText());
        assertFalse(second.has("nodeId"));

        assertEquals(recorder.records(), RoundRecorder.read(out));
    }

    @Test
    void readingMissingFileFailsWithPath() {
        Path missing = tempDir.resolve("absent.json");
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> RoundRecorder.read(missing));
        assertTrue(ex.getMessage().contains("absent.json"));
    }

    @Test
    void rejectsNonPositivePrefix() {
        assertThrows(IllegalArgumentException.class, () -> new RoundRecorder(0));
    }
}
