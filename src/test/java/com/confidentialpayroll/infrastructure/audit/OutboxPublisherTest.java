package com.confidentialpayroll.infrastructure.audit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutboxPublisherTest {

    private final ProtocolAuditEntryRepository repository = mock(ProtocolAuditEntryRepository.class);
    private final OutboxPublisher publisher = new OutboxPublisher(repository);

    @Test
    void marks_pending_entries_published() {
        List<ProtocolAuditEntry> pending = AuditChainTest.chainOf(2);
        when(repository.findByPublishedFalseOrderBySequenceAsc()).thenReturn(pending);

        publisher.publish();

        assertTrue(pending.stream().allMatch(ProtocolAuditEntry::isPublished));
        verify(repository, times(2)).save(any(ProtocolAuditEntry.class));
    }

    @Test
    void nothing_pending_means_no_writes() {
        when(repository.findByPublishedFalseOrderBySequenceAsc()).thenReturn(List.of());

        publisher.publish();

        verify(repository, never()).save(any(ProtocolAuditEntry.class));
    }
}
