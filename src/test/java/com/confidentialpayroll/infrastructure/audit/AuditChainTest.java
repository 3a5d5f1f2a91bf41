package com.confidentialpayroll.infrastructure.audit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class AuditChainTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    static ProtocolAuditEntry link(String previousHash, long sequence, String type, long batchId, String payload) {
        Instant at = T0.plusSeconds(sequence);
        return ProtocolAuditEntry.builder()
            .sequence(sequence)
            .eventType(type)
            .batchId(batchId)
            .payload(payload)
            .createdAt(at)
            .previousHash(previousHash)
            .entryHash(AuditChain.computeHash(previousHash, sequence, type, batchId, payload, at))
            .build();
    }

    static List<ProtocolAuditEntry> chainOf(int length) {
        List<ProtocolAuditEntry> entries = new ArrayList<>();
        String previous = AuditChain.GENESIS_HASH;
        for (int i = 1; i <= length; i++) {
            ProtocolAuditEntry entry = link(previous, i, "BatchOpened", i, "{\"batchId\":" + i + "}");
            entries.add(entry);
            previous = entry.getEntryHash();
        }
        return entries;
    }

    @Test
    void intact_chain_verifies() {
        assertEquals(OptionalLong.empty(), AuditChain.firstBrokenLink(chainOf(5)));
        assertEquals(OptionalLong.empty(), AuditChain.firstBrokenLink(List.of()));
    }

    @Test
    void hash_is_hex_sha256_and_sensitive_to_every_field() {
        String base = AuditChain.computeHash(AuditChain.GENESIS_HASH, 1, "BatchOpened", 1, "{}", T0);

        assertEquals(64, base.length());
        assertNotEquals(base, AuditChain.computeHash(AuditChain.GENESIS_HASH, 2, "BatchOpened", 1, "{}", T0));
        assertNotEquals(base, AuditChain.computeHash(AuditChain.GENESIS_HASH, 1, "BatchClosed", 1, "{}", T0));
        assertNotEquals(base, AuditChain.computeHash(AuditChain.GENESIS_HASH, 1, "BatchOpened", 2, "{}", T0));
        assertNotEquals(base, AuditChain.computeHash(AuditChain.GENESIS_HASH, 1, "BatchOpened", 1, "{ }", T0));
        assertNotEquals(base, AuditChain.computeHash(AuditChain.GENESIS_HASH, 1, "BatchOpened", 1, "{}", T0.plusMillis(1)));
    }

    @Test
    void edited_payload_is_detected() {
        List<ProtocolAuditEntry> entries = chainOf(4);
        ProtocolAuditEntry original = entries.get(2);
        entries.set(2, ProtocolAuditEntry.builder()
            .sequence(original.getSequence())
            .eventType(original.getEventType())
            .batchId(original.getBatchId())
            .payload("{\"batchId\":99}")
            .createdAt(original.getCreatedAt())
            .previousHash(original.getPreviousHash())
            .entryHash(original.getEntryHash())
            .build());

        assertEquals(OptionalLong.of(3), AuditChain.firstBrokenLink(entries));
    }

    @Test
    void dropped_entry_is_detected() {
        List<ProtocolAuditEntry> entries = chainOf(4);
        entries.remove(1);

        assertEquals(OptionalLong.of(3), AuditChain.firstBrokenLink(entries));
    }

    @Test
    void rehashed_forgery_breaks_the_next_link() {
        List<ProtocolAuditEntry> entries = chainOf(3);
        ProtocolAuditEntry original = entries.get(1);
        entries.set(1, link(original.getPreviousHash(), 2, "BatchOpened", 2, "{\"batchId\":42}"));

        assertEquals(OptionalLong.of(3), AuditChain.firstBrokenLink(entries));
    }
}
