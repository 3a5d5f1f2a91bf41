package com.confidentialpayroll.domain.model;

import java.nio.ByteBuffer;

/**
 * Verified cleartext aggregate.
 *
 * <p>Values are unsigned 64-bit integers carried in a {@code long}; use
 * {@link Long#toUnsignedString(long)} when rendering.
 */
public record DecryptedTotals(long totalSalary, long totalBonus) {

    /**
     * Encoded size: two 8-byte big-endian words.
     */
    public static final int ENCODED_LENGTH = 2 * Long.BYTES;

    /**
     * Decode oracle cleartexts.
     *
     * @throws IllegalArgumentException if the length is not {@link #ENCODED_LENGTH}
     */
    public static DecryptedTotals decode(byte[] cleartexts) {
        if (cleartexts == null || cleartexts.length != ENCODED_LENGTH) {
            throw new IllegalArgumentException("Expected " + ENCODED_LENGTH + " cleartext bytes, got "
                + (cleartexts == null ? 0 : cleartexts.length));
        }
        ByteBuffer buffer = ByteBuffer.wrap(cleartexts);
        return new DecryptedTotals(buffer.getLong(), buffer.getLong());
    }

    public byte[] encode() {
        return ByteBuffer.allocate(ENCODED_LENGTH)
            .putLong(totalSalary)
            .putLong(totalBonus)
            .array();
    }
}
