package com.confidentialpayroll.application;

import com.confidentialpayroll.config.ProtocolProperties;
import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.domain.repository.DecryptionContextRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Reports decryption requests that have waited too long for their callback.
 *
 * <p>Requests are never cancelled or expired: a pending context stays pending. A provider
 * may issue a fresh request for the same batch once its cooldown allows.
 */
@Component
@Slf4j
public class PendingDecryptionMonitor {

    private final DecryptionContextRepository contextRepository;
    private final Clock clock;
    private final Duration warningAfter;

    @Autowired
    public PendingDecryptionMonitor(
            DecryptionContextRepository contextRepository,
            Clock clock,
            ProtocolProperties properties) {

        this(contextRepository, clock, properties.getOracle().getPendingWarningAfter());
    }

    public PendingDecryptionMonitor(DecryptionContextRepository contextRepository, Clock clock, Duration warningAfter) {
        this.contextRepository = contextRepository;
        this.clock = clock;
        this.warningAfter = warningAfter;
    }

    /**
     * @return Pending contexts requested longer ago than the warning threshold
     */
    public List<DecryptionContext> findStalled() {
        return contextRepository.findPendingRequestedBefore(clock.instant().minus(warningAfter));
    }

    @Scheduled(fixedDelayString = "${payroll.oracle.pending-check-interval:PT1M}")
    public void reportStalled() {
        List<DecryptionContext> stalled = findStalled();
        for (DecryptionContext context : stalled) {
            log.warn("Decryption request {} for batch {} pending since {}",
                context.getRequestId(), context.getBatchId(), context.getRequestedAt());
        }
        if (!stalled.isEmpty()) {
            log.warn("{} decryption request(s) pending longer than {}", stalled.size(), warningAfter);
        }
    }
}
