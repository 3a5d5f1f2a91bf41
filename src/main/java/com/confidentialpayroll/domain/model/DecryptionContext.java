package com.confidentialpayroll.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending or finalized decryption of a batch aggregate, keyed by the oracle's request id.
 *
 * <p>{@code processed} moves from {@code false} to {@code true} exactly once. A processed
 * context is terminal.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "decryption_contexts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class DecryptionContext {

    @Id
    @Column(name = "request_id", nullable = false, updatable = false)
    private Long requestId;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private long batchId;

    /**
     * Binding hash of the ciphertexts handed to the oracle.
     */
    @Getter(AccessLevel.NONE)
    @Column(name = "commitment", nullable = false, updatable = false, length = 32)
    private byte[] commitment;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "requested_by", nullable = false, updatable = false, length = 128)
    private String requestedBy;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Getter(AccessLevel.NONE)
    @Column(name = "total_salary")
    private Long totalSalary;

    @Getter(AccessLevel.NONE)
    @Column(name = "total_bonus")
    private Long totalBonus;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private DecryptionContext(long requestId, long batchId, byte[] commitment, Identity requestedBy, Instant at) {
        this.requestId = requestId;
        this.batchId = batchId;
        this.commitment = commitment.clone();
        this.requestedBy = requestedBy.value();
        this.requestedAt = at;
        this.processed = false;
    }

    public static DecryptionContext pending(
            long requestId,
            long batchId,
            byte[] commitment,
            Identity requestedBy,
            Instant requestedAt) {

        Objects.requireNonNull(commitment, "commitment");
        if (commitment.length == 0) {
            throw new IllegalArgumentException("Commitment must not be empty");
        }
        return new DecryptionContext(
            requestId,
            batchId,
            commitment,
            Objects.requireNonNull(requestedBy, "requestedBy"),
            Objects.requireNonNull(requestedAt, "requestedAt")
        );
    }

    /**
     * Terminal transition.
     *
     * @throws IllegalStateException if already processed
     */
    public void finalizeWith(DecryptedTotals totals, Instant at) {
        if (processed) {
            throw new IllegalStateException("Decryption request " + requestId + " already processed");
        }
        this.processed = true;
        this.processedAt = at;
        this.totalSalary = totals.totalSalary();
        this.totalBonus = totals.totalBonus();
    }

    public byte[] getCommitment() {
        return commitment.clone();
    }

    public Identity getRequestedBy() {
        return Identity.of(requestedBy);
    }

    /**
     * Cleartext totals, present once processed.
     */
    public Optional<DecryptedTotals> getTotals() {
        if (!processed || totalSalary == null || totalBonus == null) {
            return Optional.empty();
        }
        return Optional.of(new DecryptedTotals(totalSalary, totalBonus));
    }
}
