package com.confidentialpayroll.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DecryptionContextTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");
    private static final Identity PROVIDER = Identity.of("provider");

    @Test
    void pending_context_has_no_totals() {
        DecryptionContext context = DecryptionContext.pending(10, 1, new byte[]{1, 2}, PROVIDER, NOW);

        assertFalse(context.isProcessed());
        assertTrue(context.getTotals().isEmpty());
        assertEquals(PROVIDER, context.getRequestedBy());
    }

    @Test
    void finalize_is_terminal() {
        DecryptionContext context = DecryptionContext.pending(10, 1, new byte[]{1, 2}, PROVIDER, NOW);
        context.finalizeWith(new DecryptedTotals(3000, 180000), NOW.plusSeconds(5));

        assertTrue(context.isProcessed());
        assertEquals(NOW.plusSeconds(5), context.getProcessedAt());
        assertEquals(new DecryptedTotals(3000, 180000), context.getTotals().orElseThrow());
        assertThrows(IllegalStateException.class,
            () -> context.finalizeWith(new DecryptedTotals(1, 1), NOW.plusSeconds(6)));
        assertEquals(3000, context.getTotals().orElseThrow().totalSalary());
    }

    @Test
    void commitment_is_copied_and_required() {
        byte[] commitment = {4, 5, 6};
        DecryptionContext context = DecryptionContext.pending(10, 1, commitment, PROVIDER, NOW);
        commitment[0] = 0;

        assertArrayEquals(new byte[]{4, 5, 6}, context.getCommitment());
        assertThrows(IllegalArgumentException.class,
            () -> DecryptionContext.pending(11, 1, new byte[0], PROVIDER, NOW));
    }
}
