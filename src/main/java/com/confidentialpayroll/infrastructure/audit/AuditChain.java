package com.confidentialpayroll.infrastructure.audit;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.OptionalLong;

/**
 * Hash chain over audit entries.
 *
 * <p>{@code entryHash = SHA-256(previousHash || sequence || eventType || batchId || payload || createdAt)},
 * with a genesis {@code previousHash} of 64 zeros. Editing, dropping or reordering any
 * entry breaks every later link.
 */
public final class AuditChain {

    public static final String GENESIS_HASH = "0".repeat(64);

    private AuditChain() {}

    public static String computeHash(
            String previousHash,
            long sequence,
            String eventType,
            long batchId,
            String payload,
            Instant createdAt) {

        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(previousHash.getBytes(StandardCharsets.US_ASCII));
            digest.update(ByteBuffer.allocate(2 * Long.BYTES).putLong(sequence).putLong(batchId).array());
            digest.update(eventType.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(payload.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(createdAt.toString().getBytes(StandardCharsets.US_ASCII));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String computeHash(ProtocolAuditEntry entry) {
        return computeHash(
            entry.getPreviousHash(),
            entry.getSequence(),
            entry.getEventType(),
            entry.getBatchId(),
            entry.getPayload(),
            entry.getCreatedAt()
        );
    }

    /**
     * Find the first entry whose link is broken.
     *
     * @param entries Entries ordered by sequence
     * @return Sequence of the first broken entry, empty if the chain is intact
     */
    public static OptionalLong firstBrokenLink(List<ProtocolAuditEntry> entries) {
        String expectedPrevious = GENESIS_HASH;
        long expectedSequence = 1;
        for (ProtocolAuditEntry entry : entries) {
            if (entry.getSequence() != expectedSequence
                    || !expectedPrevious.equals(entry.getPreviousHash())
                    || !computeHash(entry).equals(entry.getEntryHash())) {
                return OptionalLong.of(entry.getSequence());
            }
            expectedPrevious = entry.getEntryHash();
            expectedSequence++;
        }
        return OptionalLong.empty();
    }
}
