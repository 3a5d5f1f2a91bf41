package com.confidentialpayroll.infrastructure.audit;

import com.confidentialpayroll.infrastructure.audit.AuditChainVerifier.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuditChainVerifierTest {

    private final ProtocolAuditEntryRepository repository = mock(ProtocolAuditEntryRepository.class);
    private final AuditChainVerifier verifier = new AuditChainVerifier(repository);

    @Test
    void reports_intact_ledger() {
        when(repository.findAllByOrderBySequenceAsc()).thenReturn(AuditChainTest.chainOf(3));

        assertEquals(new VerificationResult(true, 3, null), verifier.verify());
    }

    @Test
    void reports_first_broken_sequence() {
        List<ProtocolAuditEntry> entries = AuditChainTest.chainOf(3);
        entries.remove(0);
        when(repository.findAllByOrderBySequenceAsc()).thenReturn(entries);

        VerificationResult result = verifier.verify();

        assertFalse(result.intact());
        assertEquals(2L, result.firstBrokenSequence());
    }
}
