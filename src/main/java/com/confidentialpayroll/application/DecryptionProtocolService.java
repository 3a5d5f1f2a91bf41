package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.ConsistencyException;
import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.application.exceptions.ProofVerificationException;
import com.confidentialpayroll.application.exceptions.ProtocolException;
import com.confidentialpayroll.application.exceptions.ReplayException;
import com.confidentialpayroll.application.exceptions.ResourceNotFoundException;
import com.confidentialpayroll.config.PerformanceConfiguration.BusinessMetrics;
import com.confidentialpayroll.domain.model.AggregateCiphertexts;
import com.confidentialpayroll.domain.model.DecryptedTotals;
import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.model.ProtocolEvent;
import com.confidentialpayroll.domain.repository.DecryptionContextRepository;
import com.confidentialpayroll.infrastructure.audit.ProtocolEventRecorder;
import com.confidentialpayroll.infrastructure.fhe.DecryptionOracle;
import com.confidentialpayroll.infrastructure.fhe.DecryptionResultListener;
import com.confidentialpayroll.infrastructure.security.AccessControl;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Decryption commitment and verification protocol.
 *
 * <p>Request time: aggregate the closed batch, commit to the resulting ciphertexts, hand
 * them to the oracle and record a pending {@link DecryptionContext}.
 *
 * <p>Callback time, checked in this order and before any write:
 * <ol>
 *   <li>caller holds the oracle capability</li>
 *   <li>the request id is known</li>
 *   <li>the context is not yet processed (replay guard)</li>
 *   <li>re-aggregating the batch yields the committed ciphertexts (consistency)</li>
 *   <li>the oracle's proof covers the cleartexts</li>
 *   <li>the cleartexts decode to two 64-bit totals</li>
 * </ol>
 * Only then is the context finalized, exactly once.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecryptionProtocolService implements DecryptionResultListener {

    static final String ORACLE_CHANNEL = "oracle-callback";

    private final DecryptionContextRepository contextRepository;
    private final AggregationEngine aggregationEngine;
    private final CommitmentCalculator commitmentCalculator;
    private final DecryptionOracle decryptionOracle;
    private final AccessControl accessControl;
    private final CooldownPolicy cooldownPolicy;
    private final ProtocolEventRecorder eventRecorder;
    private final ProtocolStateGuard stateGuard;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    /**
     * Ask the oracle to decrypt the aggregate of a closed batch.
     *
     * <p>The oracle is called inside the state transition. If a later step fails, the
     * transaction rolls back and the oracle drops the request before scheduling its callback.
     *
     * @param caller Must hold the provider capability
     * @param batchId Closed batch
     * @return Pending context keyed by the oracle's request id
     */
    public DecryptionContext requestBatchDecryption(CallerContext caller, long batchId) {
        return stateGuard.execute("requestBatchDecryption", () -> {
            accessControl.requireProvider(caller);
            accessControl.requireNotPaused();

            Instant now = clock.instant();
            cooldownPolicy.checkDecryptionRequest(caller.getPrincipal(), now);

            AggregateCiphertexts aggregate = aggregationEngine.aggregate(batchId);
            byte[] commitment = commitmentCalculator.commit(aggregate);

            long requestId = decryptionOracle.requestDecryption(aggregate.asList());
            if (contextRepository.existsByRequestId(requestId)) {
                throw new IllegalStateException("Oracle reissued request id " + requestId);
            }

            DecryptionContext context = DecryptionContext.pending(
                requestId, batchId, commitment, caller.getPrincipal(), now);
            contextRepository.save(context);

            cooldownPolicy.stampDecryptionRequest(caller.getPrincipal(), now);

            String commitmentHex = HexFormat.of().formatHex(commitment);
            eventRecorder.record(new ProtocolEvent.DecryptionRequested(
                requestId, batchId, commitmentHex, caller.getPrincipal(), now));
            businessMetrics.recordDecryptionRequested();

            log.info("Decryption requested: requestId={}, batchId={}, contributors={}, commitment={}, by={}",
                requestId, batchId, aggregate.includedContributors(),
                commitmentHex.substring(0, 16), caller.getPrincipal());
            return context;
        });
    }

    /**
     * Accept, verify and finalize an oracle result.
     *
     * @param caller Must hold the oracle capability
     * @param requestId Oracle request id
     * @param cleartexts Two 8-byte big-endian words: total salary, total bonus
     * @param proof Oracle attestation over {@code requestId} and {@code cleartexts}
     * @return Verified totals
     */
    public DecryptedTotals onDecryptionCallback(
            CallerContext caller,
            long requestId,
            byte[] cleartexts,
            byte[] proof) {

        try {
            return stateGuard.execute("onDecryptionCallback",
                () -> verifyAndFinalize(caller, requestId, cleartexts, proof));
        } catch (ProtocolException e) {
            businessMetrics.recordCallbackRejected(e.getCode().name());
            throw e;
        }
    }

    @Override
    public void onDecryptionResult(Identity oracle, long requestId, byte[] cleartexts, byte[] proof) {
        onDecryptionCallback(CallerContext.of(oracle, clock.instant(), ORACLE_CHANNEL), requestId, cleartexts, proof);
    }

    public DecryptionContext getDecryptionContext(long requestId) {
        return contextRepository.findByRequestId(requestId)
            .orElseThrow(() -> new ResourceNotFoundException("Decryption request not found: " + requestId));
    }

    public List<DecryptionContext> listDecryptionContexts(long batchId) {
        return contextRepository.findByBatchId(batchId);
    }

    private DecryptedTotals verifyAndFinalize(
            CallerContext caller,
            long requestId,
            byte[] cleartexts,
            byte[] proof) {

        accessControl.requireOracle(caller);

        DecryptionContext context = contextRepository.findByRequestId(requestId)
            .orElseThrow(() -> LifecycleException.unknownRequest(requestId));

        if (context.isProcessed()) {
            log.warn("SECURITY: replayed callback for decryption request {}", requestId);
            throw new ReplayException(requestId);
        }

        AggregateCiphertexts current = aggregationEngine.aggregate(context.getBatchId());
        if (!commitmentCalculator.matches(context.getCommitment(), commitmentCalculator.commit(current))) {
            log.warn("SECURITY: commitment mismatch for decryption request {} on batch {}",
                requestId, context.getBatchId());
            throw new ConsistencyException(requestId, context.getBatchId());
        }

        if (!decryptionOracle.verifyProof(requestId, cleartexts, proof)) {
            log.warn("SECURITY: invalid decryption proof for request {}", requestId);
            throw ProofVerificationException.invalidProof(requestId);
        }

        DecryptedTotals totals;
        try {
            totals = DecryptedTotals.decode(cleartexts);
        } catch (IllegalArgumentException e) {
            throw ProofVerificationException.malformedCleartexts(requestId, e);
        }

        Instant now = clock.instant();
        context.finalizeWith(totals, now);
        contextRepository.save(context);

        eventRecorder.record(new ProtocolEvent.DecryptionCompleted(
            requestId, context.getBatchId(), totals.totalSalary(), totals.totalBonus(), now));
        businessMetrics.recordDecryptionCompleted();

        log.info("Decryption finalized: requestId={}, batchId={}", requestId, context.getBatchId());
        return totals;
    }
}
