package com.confidentialpayroll.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProtocolAuditEntryRepository extends JpaRepository<ProtocolAuditEntry, Long> {

    Optional<ProtocolAuditEntry> findTopByOrderBySequenceDesc();

    List<ProtocolAuditEntry> findByPublishedFalseOrderBySequenceAsc();

    List<ProtocolAuditEntry> findAllByOrderBySequenceAsc();
}
