package com.confidentialpayroll.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Encrypted totals of one closed batch.
 *
 * @param batchId Aggregated batch
 * @param totalSalary Encrypted sum of salaries
 * @param totalBonus Encrypted sum of salary times score
 * @param includedContributors Number of records folded in
 */
public record AggregateCiphertexts(
    long batchId,
    Ciphertext totalSalary,
    Ciphertext totalBonus,
    int includedContributors
) {

    public AggregateCiphertexts {
        Objects.requireNonNull(totalSalary, "totalSalary");
        Objects.requireNonNull(totalBonus, "totalBonus");
    }

    /**
     * Ciphertexts in the order they are committed to and sent to the oracle.
     */
    public List<Ciphertext> asList() {
        return List.of(totalSalary, totalBonus);
    }
}
