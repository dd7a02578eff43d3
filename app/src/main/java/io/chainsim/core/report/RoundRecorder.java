package io.chainsim.core.report;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainsim.core.node.Node;
import io.chainsim.core.protocol.BlockIds;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Collects one {@link RoundRecord} per node per round and writes them as a JSON array:
 * all nodes of round 0 first, then round 1, and so on.
 */
public final class RoundRecorder {
    private static final Logger LOG = Logger.getLogger(RoundRecorder.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private final int hashPrefixLength;
    private final List<RoundRecord> records = new ArrayList<>();

    public RoundRecorder(int hashPrefixLength) {
        if (hashPrefixLength < 1) {
            throw new IllegalArgumentException("hash prefix length must be positive: " + hashPrefixLength);
        }
        this.hashPrefixLength = hashPrefixLength;
    }

    /** Snapshot every node's (id, height, tip) for {@code round}. */
    public List<RoundRecord> record(int round, List<Node> nodes) {
        List<RoundRecord> snapshot = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            snapshot.add(new RoundRecord(
                    round,
                    node.nodeId(),
                    node.height(),
                    BlockIds.shorten(node.tip().id(), hashPrefixLength)));
        }
        records.addAll(snapshot);
        return snapshot;
    }

    public List<RoundRecord> records() {
        return List.copyOf(records);
    }

    public void writeTo(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), records);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write round records to " + path, e);
        }
        LOG.info(() -> "Wrote " + records.size() + " round records to " + path);
    }

    public static List<RoundRecord> read(Path path) {
        try {
            return JSON.readValue(path.toFile(), new TypeReference<List<RoundRecord>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read round records from " + path, e);
        }
    }
}
