package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.DuplicateContributionException;
import com.confidentialpayroll.application.exceptions.InvalidCiphertextException;
import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.application.exceptions.ResourceNotFoundException;
import com.confidentialpayroll.config.PerformanceConfiguration.BusinessMetrics;
import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.model.ProtocolEvent;
import com.confidentialpayroll.domain.repository.BatchRepository;
import com.confidentialpayroll.domain.repository.EncryptedRecordRepository;
import com.confidentialpayroll.infrastructure.audit.ProtocolEventRecorder;
import com.confidentialpayroll.infrastructure.fhe.HomomorphicLibrary;
import com.confidentialpayroll.infrastructure.security.AccessControl;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Contribution submission into the current batch, and the encrypted record store behind it.
 *
 * <p>Checks run in a fixed order and all precede any write:
 * {@code NOT_PROVIDER, PAUSED, COOLDOWN_ACTIVE, INVALID_BATCH, DUPLICATE_CONTRIBUTION,
 * INVALID_CIPHERTEXT}. Uninitialized ciphertexts are replaced by an encryption of zero, the
 * additive identity, so the stored record is always fully initialized. An initialized handle
 * the homomorphic library never issued is refused: aggregating it would fail for the whole batch.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContributionService {

    private final EncryptedRecordRepository recordRepository;
    private final BatchRepository batchRepository;
    private final HomomorphicLibrary homomorphicLibrary;
    private final AccessControl accessControl;
    private final CooldownPolicy cooldownPolicy;
    private final ProtocolEventRecorder eventRecorder;
    private final ProtocolStateGuard stateGuard;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    /**
     * Submit an encrypted (salary, score) pair for a contributor.
     *
     * @param caller Data provider submitting on behalf of {@code identity}
     * @param identity Contributor the record belongs to
     * @param salary Encrypted salary, may be uninitialized
     * @param score Encrypted performance score, may be uninitialized
     * @return Stored record
     */
    public EncryptedRecord submitContribution(
            CallerContext caller,
            Identity identity,
            Ciphertext salary,
            Ciphertext score) {

        return stateGuard.execute("submitContribution", () -> {
            accessControl.requireProvider(caller);
            accessControl.requireNotPaused();

            Instant now = clock.instant();
            cooldownPolicy.checkSubmission(caller.getPrincipal(), now);

            Batch batch = batchRepository.findCurrent()
                .filter(Batch::isOpen)
                .orElseThrow(() -> LifecycleException.invalidBatch("No open batch accepts contributions"));
            if (batch.hasContributed(identity)) {
                throw new DuplicateContributionException(identity, batch.getId());
            }

            requireKnown(salary, "salary", identity);
            requireKnown(score, "score", identity);

            boolean coerced = !homomorphicLibrary.isInitialized(salary) || !homomorphicLibrary.isInitialized(score);
            Ciphertext storedSalary = initializedOrZero(salary, "salary", identity);
            Ciphertext storedScore = initializedOrZero(score, "score", identity);

            EncryptedRecord record = recordRepository.findByIdentity(identity)
                .map(existing -> {
                    existing.replace(storedSalary, storedScore, batch.getId(), caller.getPrincipal(), now);
                    return existing;
                })
                .orElseGet(() -> EncryptedRecord.create(
                    identity, storedSalary, storedScore, batch.getId(), caller.getPrincipal(), now));
            recordRepository.save(record);

            batch.addContributor(identity);
            batchRepository.save(batch);

            cooldownPolicy.stampSubmission(caller.getPrincipal(), now);

            eventRecorder.record(new ProtocolEvent.ContributionSubmitted(
                identity,
                batch.getId(),
                storedSalary.toBase64(),
                storedScore.toBase64(),
                caller.getPrincipal(),
                now
            ));
            businessMetrics.recordContribution(coerced);

            log.info("Contribution accepted: identity={}, batchId={}, provider={}, salary={}, score={}",
                identity, batch.getId(), caller.getPrincipal(), storedSalary, storedScore);
            return record;
        });
    }

    /**
     * Encrypt a client input. Stateless; the plaintext is neither stored nor logged.
     *
     * @param caller Must hold the provider capability
     * @param plaintext Unsigned 64-bit value
     * @return Fresh ciphertext
     */
    public Ciphertext encryptInput(CallerContext caller, long plaintext) {
        accessControl.requireProvider(caller);
        return homomorphicLibrary.encrypt(plaintext);
    }

    /**
     * Ciphertext handles stored for an identity.
     */
    public EncryptedRecord getRecord(Identity identity) {
        return recordRepository.findByIdentity(identity)
            .orElseThrow(() -> new ResourceNotFoundException("No record for " + identity));
    }

    private void requireKnown(Ciphertext ciphertext, String field, Identity identity) {
        if (homomorphicLibrary.isInitialized(ciphertext) && !homomorphicLibrary.isKnown(ciphertext)) {
            throw new InvalidCiphertextException(field, identity);
        }
    }

    private Ciphertext initializedOrZero(Ciphertext ciphertext, String field, Identity identity) {
        if (homomorphicLibrary.isInitialized(ciphertext)) {
            return ciphertext;
        }
        log.warn("Uninitialized {} ciphertext for {} replaced by Enc(0)", field, identity);
        return homomorphicLibrary.encryptZero();
    }
}
