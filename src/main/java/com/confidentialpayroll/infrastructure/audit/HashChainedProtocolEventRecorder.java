package com.confidentialpayroll.infrastructure.audit;

import com.confidentialpayroll.domain.model.ProtocolEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records protocol events as links of the hash-chained audit ledger.
 *
 * <p>Runs inside the caller's state transition, which holds the protocol lock, so the
 * sequence read here cannot race with another writer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HashChainedProtocolEventRecorder implements ProtocolEventRecorder {

    private final ProtocolAuditEntryRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public void record(ProtocolEvent event) {
        String payload = serialize(event);

        ProtocolAuditEntry last = repository.findTopByOrderBySequenceDesc().orElse(null);
        long sequence = last == null ? 1 : last.getSequence() + 1;
        String previousHash = last == null ? AuditChain.GENESIS_HASH : last.getEntryHash();

        ProtocolAuditEntry entry = ProtocolAuditEntry.builder()
            .sequence(sequence)
            .eventType(event.getType())
            .batchId(event.getBatchId())
            .payload(payload)
            .createdAt(event.getOccurredAt())
            .previousHash(previousHash)
            .entryHash(AuditChain.computeHash(
                previousHash, sequence, event.getType(), event.getBatchId(), payload, event.getOccurredAt()))
            .published(false)
            .build();
        repository.save(entry);

        log.info("AUDIT event={} batchId={} sequence={} hash={}",
            event.getType(), event.getBatchId(), sequence, entry.getEntryHash().substring(0, 16));
    }

    private String serialize(ProtocolEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event " + event.getType(), e);
        }
    }
}
