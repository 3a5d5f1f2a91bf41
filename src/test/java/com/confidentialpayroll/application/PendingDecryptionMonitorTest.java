package com.confidentialpayroll.application;

import com.confidentialpayroll.domain.model.DecryptedTotals;
import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.support.InMemoryDecryptionContextRepository;
import com.confidentialpayroll.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingDecryptionMonitorTest {

    private static final Identity PROVIDER = Identity.of("provider");

    @Test
    void reports_only_pending_requests_older_than_threshold() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        InMemoryDecryptionContextRepository contexts = new InMemoryDecryptionContextRepository();
        PendingDecryptionMonitor monitor = new PendingDecryptionMonitor(contexts, clock, Duration.ofMinutes(5));

        contexts.save(DecryptionContext.pending(1, 1, new byte[]{1}, PROVIDER, clock.instant()));
        DecryptionContext done = DecryptionContext.pending(2, 1, new byte[]{1}, PROVIDER, clock.instant());
        done.finalizeWith(new DecryptedTotals(1, 1), clock.instant());
        contexts.save(done);

        clock.advance(Duration.ofMinutes(4));
        contexts.save(DecryptionContext.pending(3, 1, new byte[]{1}, PROVIDER, clock.instant()));
        assertTrue(monitor.findStalled().isEmpty());

        clock.advance(Duration.ofMinutes(2));
        List<DecryptionContext> stalled = monitor.findStalled();

        assertEquals(1, stalled.size());
        assertEquals(1L, stalled.get(0).getRequestId());
        assertDoesNotThrow(monitor::reportStalled);
    }
}
