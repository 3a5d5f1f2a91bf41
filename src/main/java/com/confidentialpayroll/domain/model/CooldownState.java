package com.confidentialpayroll.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Last submission and last decryption-request times of one caller.
 */
@Entity
@Table(name = "cooldowns")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class CooldownState {

    @Id
    @Column(name = "identity", nullable = false, updatable = false, length = 128)
    private String identity;

    @Getter(AccessLevel.NONE)
    @Column(name = "last_submission_at")
    private Instant lastSubmissionAt;

    @Getter(AccessLevel.NONE)
    @Column(name = "last_decryption_request_at")
    private Instant lastDecryptionRequestAt;

    public CooldownState(Identity identity) {
        this.identity = identity.value();
    }

    public Identity getIdentity() {
        return Identity.of(identity);
    }

    public Optional<Instant> getLastSubmissionAt() {
        return Optional.ofNullable(lastSubmissionAt);
    }

    public Optional<Instant> getLastDecryptionRequestAt() {
        return Optional.ofNullable(lastDecryptionRequestAt);
    }

    public void stampSubmission(Instant at) {
        this.lastSubmissionAt = at;
    }

    public void stampDecryptionRequest(Instant at) {
        this.lastDecryptionRequestAt = at;
    }
}
