package io.chainsim.core.protocol;

import java.util.Random;
import java.util.UUID;

/**
 * Block identifiers are opaque strings shaped like random (version 4) UUIDs.
 * They are not content hashes; collisions are treated as impossible.
 */
public final class BlockIds {
    /** Identifier shared by every node's genesis block. */
    public static final String GENESIS_ID = "00000000-0000-0000-0000-000000000000";

    /** Prefix length used when printing ids. */
    public static final int DISPLAY_LENGTH = 6;

    private BlockIds() {}

    /** Draws 122 random bits from {@code rnd} and renders them as a version 4 UUID string. */
    public static String randomId(Random rnd) {
        long msb = rnd.nextLong();
        long lsb = rnd.nextLong();
        msb = (msb & 0xffffffffffff0fffL) | 0x0000000000004000L; // version 4
        lsb = (lsb & 0x3fffffffffffffffL) | 0x8000000000000000L; // IETF variant
        return new UUID(msb, lsb).toString();
    }

    /** First {@code length} characters of {@code id}, or null for a null id. */
    public static String shorten(String id, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Prefix length must be positive: " + length);
        }
        if (id == null) return null;
        return id.length() <= length ? id : id.substring(0, length);
    }

    public static String shorten(String id) {
        return shorten(id, DISPLAY_LENGTH);
    }
}
