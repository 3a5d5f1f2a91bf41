package com.confidentialpayroll;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the confidential payroll aggregation service.
 *
 * <p>Data providers submit encrypted (salary, performance score) pairs into time-boxed
 * batches. A closed batch is aggregated over ciphertexts and its totals are released only
 * through a committed, proof-checked and replay-protected decryption round trip.
 *
 * <ul>
 *   <li><strong>Batch lifecycle</strong>: monotonically numbered batches, {@code Open -> Closed}</li>
 *   <li><strong>Encrypted record store</strong>: one ciphertext pair per contributor</li>
 *   <li><strong>Aggregation</strong>: deterministic homomorphic folding</li>
 *   <li><strong>Decryption protocol</strong>: commit, re-derive, verify, finalize once</li>
 *   <li><strong>Audit ledger</strong>: hash-chained record of every protocol event</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class ConfidentialPayrollApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfidentialPayrollApplication.class, args);

        log.info("Confidential payroll aggregation service started");
    }
}
