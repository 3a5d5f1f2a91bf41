package com.confidentialpayroll.application;

import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.repository.BatchRepository;
import com.confidentialpayroll.infrastructure.audit.AuditChainVerifier;
import com.confidentialpayroll.infrastructure.audit.AuditChainVerifier.VerificationResult;
import com.confidentialpayroll.infrastructure.security.AccessControl;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Pause control, availability and audit ledger verification.
 */
@Service
@RequiredArgsConstructor
public class ProtocolAdministrationService {

    private final AccessControl accessControl;
    private final BatchRepository batchRepository;
    private final PendingDecryptionMonitor pendingDecryptionMonitor;
    private final ProtocolStateGuard stateGuard;
    private final AuditChainVerifier auditChainVerifier;

    public void pause(CallerContext caller) {
        stateGuard.run("pause", () -> accessControl.pause(caller));
    }

    public void unpause(CallerContext caller) {
        stateGuard.run("unpause", () -> accessControl.unpause(caller));
    }

    /**
     * Whether mutating operations are currently accepted.
     */
    public boolean isAvailable() {
        return !accessControl.isPaused();
    }

    public ProtocolStatus status() {
        Optional<Batch> current = batchRepository.findCurrent();
        return new ProtocolStatus(
            isAvailable(),
            accessControl.isPaused(),
            current.map(Batch::getId).orElse(0L),
            current.map(Batch::isOpen).orElse(false),
            pendingDecryptionMonitor.findStalled().size()
        );
    }

    /**
     * Re-hash the audit ledger.
     *
     * @param caller Must hold the admin capability
     */
    public VerificationResult verifyAuditLedger(CallerContext caller) {
        accessControl.requireAdmin(caller);
        return auditChainVerifier.verify();
    }

    /**
     * @param available Mutating operations accepted
     * @param paused Pause flag
     * @param currentBatchId 0 before the first batch
     * @param currentBatchOpen Whether the current batch accepts contributions
     * @param stalledDecryptions Pending requests older than the warning threshold
     */
    public record ProtocolStatus(
        boolean available,
        boolean paused,
        long currentBatchId,
        boolean currentBatchOpen,
        int stalledDecryptions
    ) {
    }
}
