package com.confidentialpayroll.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Forwards unpublished ledger entries to the log stream and marks them published.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final ProtocolAuditEntryRepository repository;

    @Scheduled(fixedDelayString = "${payroll.audit.publish-interval:PT10S}")
    @Transactional
    public void publish() {
        repository.findByPublishedFalseOrderBySequenceAsc()
            .forEach(entry -> {
                if (log.isInfoEnabled()) {
                    log.info("OUTBOX publish sequence={} event={} batchId={} hash={} payload={}",
                        entry.getSequence(), entry.getEventType(), entry.getBatchId(),
                        entry.getEntryHash(), entry.getPayload());
                }
                entry.markPublished();
                repository.save(entry);
            });
    }
}
