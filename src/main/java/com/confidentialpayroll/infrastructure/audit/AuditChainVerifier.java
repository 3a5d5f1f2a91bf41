package com.confidentialpayroll.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.OptionalLong;

/**
 * Walks the audit ledger and reports the first broken link.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditChainVerifier {

    private final ProtocolAuditEntryRepository repository;

    @Transactional(readOnly = true)
    public VerificationResult verify() {
        List<ProtocolAuditEntry> entries = repository.findAllByOrderBySequenceAsc();
        OptionalLong broken = AuditChain.firstBrokenLink(entries);

        if (broken.isPresent()) {
            log.error("AUDIT ledger integrity violation at sequence {}", broken.getAsLong());
            return new VerificationResult(false, entries.size(), broken.getAsLong());
        }
        log.info("AUDIT ledger verified: {} entries", entries.size());
        return new VerificationResult(true, entries.size(), null);
    }

    /**
     * @param intact Whether every link verified
     * @param entries Number of entries checked
     * @param firstBrokenSequence Sequence of the first broken entry, {@code null} when intact
     */
    public record VerificationResult(boolean intact, int entries, Long firstBrokenSequence) {
    }
}
