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

/**
 * Encrypted salary and performance score of one contributor.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>One record per identity, replaced on every accepted submission</li>
 *   <li>Never decrypted locally; only ciphertext handles are held</li>
 *   <li>Never deleted, only superseded</li>
 * </ul>
 *
 * <p>A record is expected to be fully initialized once written by a submission, but
 * readers must still check {@link #isFullyInitialized()} before aggregating it.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "encrypted_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class EncryptedRecord {

    @Id
    @Column(name = "identity", nullable = false, updatable = false, length = 128)
    private String identity;

    @Getter(AccessLevel.NONE)
    @Column(name = "salary_handle")
    private byte[] salaryHandle;

    @Getter(AccessLevel.NONE)
    @Column(name = "score_handle")
    private byte[] scoreHandle;

    /**
     * Batch the record was last submitted into.
     */
    @Column(name = "last_batch_id", nullable = false)
    private long lastBatchId;

    @Column(name = "submitted_by", nullable = false, length = 128)
    private String submittedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private EncryptedRecord(Identity identity) {
        this.identity = identity.value();
    }

    /**
     * Create a record for an identity that has never contributed.
     */
    public static EncryptedRecord create(
            Identity identity,
            Ciphertext salary,
            Ciphertext score,
            long batchId,
            Identity submittedBy,
            Instant at) {

        EncryptedRecord record = new EncryptedRecord(Objects.requireNonNull(identity, "identity"));
        record.replace(salary, score, batchId, submittedBy, at);
        return record;
    }

    /**
     * Supersede the stored ciphertexts.
     */
    public void replace(
            Ciphertext salary,
            Ciphertext score,
            long batchId,
            Identity submittedBy,
            Instant at) {

        this.salaryHandle = Objects.requireNonNull(salary, "salary").handleOrNull();
        this.scoreHandle = Objects.requireNonNull(score, "score").handleOrNull();
        this.lastBatchId = batchId;
        this.submittedBy = Objects.requireNonNull(submittedBy, "submittedBy").value();
        this.updatedAt = Objects.requireNonNull(at, "at");
    }

    public Identity getIdentity() {
        return Identity.of(identity);
    }

    public Identity getSubmittedBy() {
        return Identity.of(submittedBy);
    }

    public Ciphertext getSalary() {
        return Ciphertext.ofNullable(salaryHandle);
    }

    public Ciphertext getScore() {
        return Ciphertext.ofNullable(scoreHandle);
    }

    public boolean isFullyInitialized() {
        return getSalary().isInitialized() && getScore().isInitialized();
    }
}
