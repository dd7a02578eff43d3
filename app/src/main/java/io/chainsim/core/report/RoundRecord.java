package io.chainsim.core.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** State of one node at the end of one round, as written to the report file. */
@JsonPropertyOrder({"node_id", "height", "hash", "round"})
public final class RoundRecord {
    private final int round;
    private final int nodeId;
    private final long height;
    private final String hash;

    @JsonCreator
    public RoundRecord(@JsonProperty("round") int round,
                       @JsonProperty("node_id") int nodeId,
                       @JsonProperty("height") long height,
                       @JsonProperty("hash") String hash) {
        this.round = round;
        this.nodeId = nodeId;
        this.height = height;
        this.hash = hash;
    }

    @JsonProperty("round")
    public int round() { return round; }

    @JsonProperty("node_id")
    public int nodeId() { return nodeId; }

    @JsonProperty("height")
    public long height() { return height; }

    /** Tip id, possibly truncated to a display prefix. */
    @JsonProperty("hash")
    public String hash() { return hash; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RoundRecord)) return false;
        RoundRecord other = (RoundRecord) o;
        return round == other.round && nodeId == other.nodeId && height == other.height
                && java.util.Objects.equals(hash, other.hash);
    }

    @Override public int hashCode() {
        return java.util.Objects.hash(round, nodeId, height, hash);
    }

    @Override public String toString() {
        return "RoundRecord{round=" + round + ", node=" + nodeId + ", height=" + height + ", hash=" + hash + "}";
    }
}
