package com.confidentialpayroll.infrastructure.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One link of the hash-chained event ledger.
 *
 * <p>Only {@code published} changes after insertion; every other column is covered by
 * {@code entryHash}.
 */
@Entity
@Table(name = "protocol_audit_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class ProtocolAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private long sequence;

    @Column(nullable = false, name = "event_type", updatable = false, length = 64)
    private String eventType;

    @Column(nullable = false, name = "batch_id", updatable = false)
    private long batchId;

    @Column(nullable = false, updatable = false, length = 4096)
    private String payload;

    @Column(nullable = false, name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(nullable = false, name = "previous_hash", updatable = false, length = 64)
    private String previousHash;

    @Column(nullable = false, name = "entry_hash", updatable = false, length = 64)
    private String entryHash;

    @Column(nullable = false)
    private boolean published;

    public void markPublished() {
        this.published = true;
    }
}
