package io.chainsim.core.protocol;

import io.chainsim.core.consensus.RandomSource;

import java.util.Objects;

/**
 * Block = (height, parent id, own id). Immutable.
 * The type does not check that {@code parentId} really names a block at {@code height - 1};
 * linkage only means something relative to a node's chain.
 */
public final class Block {
    private final long height;
    private final String parentId; // null for genesis
    private final String id;

    private Block(long height, String parentId, String id) {
        if (height < 0) throw new IllegalArgumentException("negative height: " + height);
        this.height = height;
        this.parentId = parentId;
        this.id = Objects.requireNonNull(id, "id");
    }

    /** New block with a freshly drawn identifier. */
    public static Block create(long height, String parentId, RandomSource random) {
        return new Block(height, parentId, random.nextBlockId());
    }

    /** Block with an explicit identifier (genesis override, adoption, tests). */
    public static Block of(long height, String parentId, String id) {
        return new Block(height, parentId, id);
    }

    /** A fresh copy of the fixed genesis block. Every call returns an equal block. */
    public static Block genesis() {
        return new Block(0L, null, BlockIds.GENESIS_ID);
    }

    /**
     * Copy of {@code reference} re-parented onto {@code localTipId}.
     * Height and id come from the reference; the parent is whatever tip the adopting node has,
     * so the result is not a faithful copy of the reference chain below it.
     */
    public static Block adopt(Block reference, String localTipId) {
        return new Block(reference.height, localTipId, reference.id);
    }

    public long height() { return height; }
    public String parentId() { return parentId; }
    public String id() { return id; }

    public boolean isGenesis() {
        return height == 0 && parentId == null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return height == other.height
                && Objects.equals(parentId, other.parentId)
                && id.equals(other.id);
    }

    @Override public int hashCode() {
        return Objects.hash(height, parentId, id);
    }

    @Override public String toString() {
        return "Block{h=" + height + ", hash=" + BlockIds.shorten(id) + ", parent=" + BlockIds.shorten(parentId) + "}";
    }
}
