package com.confidentialpayroll.infrastructure.fhe;

import com.confidentialpayroll.application.exceptions.ProtocolException;
import com.confidentialpayroll.config.ProtocolProperties;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Development decryption gateway.
 *
 * <p>Accepts decryption requests, and after {@code payroll.oracle.callback-delay} decrypts
 * the ciphertexts through the coprocessor, signs {@code domain || requestId || cleartexts}
 * with an ECDSA P-256 key and delivers the result to the registered
 * {@link DecryptionResultListener}. Cleartexts are each value as an 8-byte big-endian word.
 *
 * <p>A request made inside a transaction is only scheduled once that transaction commits;
 * on rollback it is discarded and no callback is delivered.
 *
 * <p>Request ids start from the gateway's start time shifted left by 12 bits, so a
 * restarted gateway does not hand out ids stored by an earlier run.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class ThresholdDecryptionGateway implements DecryptionOracle {

    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";
    private static final byte[] SIGNING_DOMAIN = "payroll-decryption-v1".getBytes(StandardCharsets.UTF_8);

    private final SymbolicFheCoprocessor coprocessor;
    private final TaskScheduler scheduler;
    private final ObjectProvider<DecryptionResultListener> listeners;
    private final Clock clock;
    private final Duration callbackDelay;
    private final Identity oracleIdentity;

    private final KeyPair signingKey;
    private final AtomicLong nextRequestId;
    private final Map<Long, List<Ciphertext>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public ThresholdDecryptionGateway(
            SymbolicFheCoprocessor coprocessor,
            @Qualifier("oracleTaskScheduler") TaskScheduler scheduler,
            ObjectProvider<DecryptionResultListener> listeners,
            Clock clock,
            ProtocolProperties properties) {

        this(
            coprocessor,
            scheduler,
            listeners,
            clock,
            properties.getOracle().getCallbackDelay(),
            Identity.of(properties.getOracle().getIdentity())
        );
    }

    public ThresholdDecryptionGateway(
            SymbolicFheCoprocessor coprocessor,
            TaskScheduler scheduler,
            ObjectProvider<DecryptionResultListener> listeners,
            Clock clock,
            Duration callbackDelay,
            Identity oracleIdentity) {

        this.coprocessor = coprocessor;
        this.scheduler = scheduler;
        this.listeners = listeners;
        this.clock = clock;
        this.callbackDelay = callbackDelay;
        this.oracleIdentity = oracleIdentity;
        this.signingKey = generateSigningKey();
        this.nextRequestId = new AtomicLong(clock.millis() << 12);
    }

    @Override
    public long requestDecryption(List<Ciphertext> ciphertexts) {
        if (ciphertexts == null || ciphertexts.isEmpty()) {
            throw new FheException("Nothing to decrypt");
        }
        for (Ciphertext ciphertext : ciphertexts) {
            if (!coprocessor.isKnown(ciphertext)) {
                throw new FheException("Ciphertext not registered with the coprocessor: " + ciphertext);
            }
        }

        long requestId = nextRequestId.getAndIncrement();
        inFlight.put(requestId, List.copyOf(ciphertexts));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_COMMITTED) {
                        scheduleDelivery(requestId);
                    } else {
                        inFlight.remove(requestId);
                        log.warn("Decryption request {} discarded: requesting transaction did not commit", requestId);
                    }
                }
            });
        } else {
            scheduleDelivery(requestId);
        }

        log.info("Decryption request {} accepted for {} ciphertexts, callback in {}",
            requestId, ciphertexts.size(), callbackDelay);
        return requestId;
    }

    @Override
    public boolean verifyProof(long requestId, byte[] cleartexts, byte[] proof) {
        if (cleartexts == null || proof == null || proof.length == 0) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(signingKey.getPublic());
            verifier.update(signingMessage(requestId, cleartexts));
            return verifier.verify(proof);
        } catch (InvalidKeyException | SignatureException | NoSuchAlgorithmException e) {
            log.warn("Proof verification failed for request {}: {}", requestId, e.getMessage());
            return false;
        }
    }

    public PublicKey getVerificationKey() {
        return signingKey.getPublic();
    }

    public Identity getOracleIdentity() {
        return oracleIdentity;
    }

    /**
     * Number of requests not yet delivered.
     */
    public int getInFlightCount() {
        return inFlight.size();
    }

    /**
     * Produce the signed result for a request without delivering it.
     */
    SignedResult decryptAndSign(long requestId, List<Ciphertext> ciphertexts) {
        ByteBuffer cleartexts = ByteBuffer.allocate(ciphertexts.size() * Long.BYTES);
        for (Ciphertext ciphertext : ciphertexts) {
            cleartexts.putLong(coprocessor.decrypt(ciphertext));
        }
        byte[] encoded = cleartexts.array();
        return new SignedResult(encoded, sign(requestId, encoded));
    }

    private void scheduleDelivery(long requestId) {
        scheduler.schedule(() -> deliver(requestId), clock.instant().plus(callbackDelay));
    }

    private void deliver(long requestId) {
        List<Ciphertext> ciphertexts = inFlight.remove(requestId);
        if (ciphertexts == null) {
            log.warn("Decryption request {} vanished before delivery", requestId);
            return;
        }

        SignedResult result;
        try {
            result = decryptAndSign(requestId, ciphertexts);
        } catch (FheException e) {
            log.error("Decryption request {} could not be served", requestId, e);
            return;
        }

        DecryptionResultListener listener = listeners.getIfAvailable();
        if (listener == null) {
            log.error("No listener registered; dropping result of decryption request {}", requestId);
            return;
        }

        try {
            listener.onDecryptionResult(oracleIdentity, requestId, result.cleartexts(), result.proof());
            log.info("Decryption request {} delivered", requestId);
        } catch (ProtocolException e) {
            log.warn("Decryption request {} rejected by protocol: code={}, reason={}",
                requestId, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Delivery of decryption request {} failed", requestId, e);
        }
    }

    private byte[] sign(long requestId, byte[] cleartexts) {
        try {
            Signature signer = Signature.getInstance(SIGNATURE_ALGORITHM);
            signer.initSign(signingKey.getPrivate());
            signer.update(signingMessage(requestId, cleartexts));
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new FheException("Failed to sign decryption result", e);
        }
    }

    private static byte[] signingMessage(long requestId, byte[] cleartexts) {
        return ByteBuffer.allocate(SIGNING_DOMAIN.length + Long.BYTES + cleartexts.length)
            .put(SIGNING_DOMAIN)
            .putLong(requestId)
            .put(cleartexts)
            .array();
    }

    private static KeyPair generateSigningKey() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new FheException("EC key generation failed", e);
        }
    }

    /**
     * Cleartexts with their proof.
     */
    record SignedResult(byte[] cleartexts, byte[] proof) {
    }
}
