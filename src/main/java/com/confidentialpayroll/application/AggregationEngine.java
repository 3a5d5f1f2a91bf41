package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.domain.model.AggregateCiphertexts;
import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.repository.BatchRepository;
import com.confidentialpayroll.domain.repository.EncryptedRecordRepository;
import com.confidentialpayroll.infrastructure.fhe.HomomorphicLibrary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Folds the records of a closed batch into {@code (Σ salary, Σ salary × score)}.
 *
 * <p>Pure function of the batch's contributor list and the record store: contributors are
 * visited in insertion order and the operand order of every homomorphic call is fixed, so
 * re-running over unchanged state yields bit-identical ciphertexts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AggregationEngine {

    private final BatchRepository batchRepository;
    private final EncryptedRecordRepository recordRepository;
    private final HomomorphicLibrary homomorphicLibrary;

    /**
     * @throws LifecycleException {@code INVALID_BATCH} if the batch does not exist or is still open
     */
    public AggregateCiphertexts aggregate(long batchId) {
        Batch batch = batchRepository.findById(batchId)
            .orElseThrow(() -> LifecycleException.invalidBatch("Batch " + batchId + " does not exist"));
        if (batch.isOpen()) {
            throw LifecycleException.invalidBatch("Batch " + batchId + " is still open");
        }

        Ciphertext totalSalary = homomorphicLibrary.encryptZero();
        Ciphertext totalBonus = homomorphicLibrary.encryptZero();
        int included = 0;

        for (Identity contributor : batch.getContributors()) {
            Optional<EncryptedRecord> record = recordRepository.findByIdentity(contributor);
            if (record.isEmpty()) {
                log.warn("Batch {}: no record for contributor {}, skipped", batchId, contributor);
                continue;
            }

            Ciphertext salary = record.get().getSalary();
            Ciphertext score = record.get().getScore();
            if (!homomorphicLibrary.isInitialized(salary) || !homomorphicLibrary.isInitialized(score)) {
                log.warn("Batch {}: partially initialized record for {}, skipped", batchId, contributor);
                continue;
            }
            if (!homomorphicLibrary.isKnown(salary) || !homomorphicLibrary.isKnown(score)) {
                log.warn("Batch {}: unrecognized ciphertext handle for {}, skipped", batchId, contributor);
                continue;
            }

            totalSalary = homomorphicLibrary.add(totalSalary, salary);
            totalBonus = homomorphicLibrary.add(totalBonus, homomorphicLibrary.multiply(salary, score));
            included++;
        }

        log.debug("Batch {} aggregated over {} of {} contributors",
            batchId, included, batch.getContributorCount());
        return new AggregateCiphertexts(batchId, totalSalary, totalBonus, included);
    }
}
