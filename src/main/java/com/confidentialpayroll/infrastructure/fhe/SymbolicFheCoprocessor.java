package com.confidentialpayroll.infrastructure.fhe;

import com.confidentialpayroll.domain.model.Ciphertext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Development homomorphic coprocessor with symbolic ciphertext handles.
 *
 * <p>Architecture:
 * <ul>
 *   <li>Handles are 32-byte identifiers; the values behind them never leave this class
 *       except through the decryption gateway</li>
 *   <li>Derived handles are SHA-256 over the operation code and operand handles, so the
 *       same computation always yields the same handle</li>
 *   <li>Values are sealed at rest with AES-256-GCM under a key generated at startup</li>
 *   <li>Arithmetic is unsigned 64-bit with wrap-around</li>
 * </ul>
 *
 * <p>The value table is in memory (as with a local KMS mock) and does not survive a
 * restart. Production deployments bind {@link HomomorphicLibrary} to a real FHE coprocessor.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@Slf4j
public class SymbolicFheCoprocessor implements HomomorphicLibrary {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int AES_KEY_SIZE = 256;
    private static final int HANDLE_LENGTH = 32;

    private static final byte OP_TRIVIAL = 0x01;
    private static final byte OP_ADD = 0x02;
    private static final byte OP_MUL = 0x03;

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey sealingKey;
    private final Map<String, byte[]> sealedValues = new ConcurrentHashMap<>();

    public SymbolicFheCoprocessor() {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(AES_KEY_SIZE, secureRandom);
            this.sealingKey = keyGen.generateKey();
        } catch (NoSuchAlgorithmException e) {
            throw new FheException("AES not available", e);
        }
    }

    @Override
    public Ciphertext encryptZero() {
        return trivialEncrypt(0L);
    }

    /**
     * Deterministic encryption of a public constant.
     */
    public Ciphertext trivialEncrypt(long plaintext) {
        byte[] handle = deriveHandle(OP_TRIVIAL, longBytes(plaintext));
        sealedValues.computeIfAbsent(key(handle), k -> seal(plaintext));
        return Ciphertext.of(handle);
    }

    @Override
    public Ciphertext encrypt(long plaintext) {
        byte[] handle = new byte[HANDLE_LENGTH];
        secureRandom.nextBytes(handle);
        sealedValues.put(key(handle), seal(plaintext));

        log.debug("Registered input ciphertext {}", key(handle).substring(0, 16));
        return Ciphertext.of(handle);
    }

    @Override
    public boolean isInitialized(Ciphertext ciphertext) {
        return ciphertext != null && ciphertext.isInitialized();
    }

    @Override
    public Ciphertext add(Ciphertext lhs, Ciphertext rhs) {
        return apply(OP_ADD, lhs, rhs);
    }

    @Override
    public Ciphertext multiply(Ciphertext lhs, Ciphertext rhs) {
        return apply(OP_MUL, lhs, rhs);
    }

    @Override
    public boolean isKnown(Ciphertext ciphertext) {
        return isInitialized(ciphertext) && sealedValues.containsKey(key(ciphertext.handle()));
    }

    /**
     * Open a ciphertext. Only the decryption gateway calls this.
     *
     * @throws FheException if the handle is unknown or the sealed value fails authentication
     */
    long decrypt(Ciphertext ciphertext) {
        return open(ciphertext);
    }

    private Ciphertext apply(byte op, Ciphertext lhs, Ciphertext rhs) {
        long a = open(lhs);
        long b = open(rhs);
        long result = op == OP_ADD ? a + b : a * b;

        byte[] handle = deriveHandle(op, lhs.handle(), rhs.handle());
        sealedValues.computeIfAbsent(key(handle), k -> seal(result));
        return Ciphertext.of(handle);
    }

    private long open(Ciphertext ciphertext) {
        if (!isInitialized(ciphertext)) {
            throw new FheException("Operand is not an initialized ciphertext");
        }
        byte[] sealed = sealedValues.get(key(ciphertext.handle()));
        if (sealed == null) {
            throw new FheException("Unknown ciphertext handle: " + ciphertext);
        }
        return unseal(sealed);
    }

    private byte[] seal(long plaintext) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, sealingKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertextWithTag = cipher.doFinal(longBytes(plaintext));

            return ByteBuffer.allocate(iv.length + ciphertextWithTag.length)
                .put(iv)
                .put(ciphertextWithTag)
                .array();
        } catch (GeneralSecurityException e) {
            log.error("Sealing failed", e);
            throw new FheException("Failed to seal value", e);
        }
    }

    private long unseal(byte[] sealed) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, sealingKey,
                new GCMParameterSpec(GCM_TAG_LENGTH, sealed, 0, GCM_IV_LENGTH));
            byte[] plaintext = cipher.doFinal(sealed, GCM_IV_LENGTH, sealed.length - GCM_IV_LENGTH);
            return ByteBuffer.wrap(plaintext).getLong();
        } catch (GeneralSecurityException e) {
            log.error("Unsealing failed", e);
            throw new FheException("Failed to unseal value", e);
        }
    }

    private static byte[] deriveHandle(byte op, byte[]... operands) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(op);
            for (byte[] operand : operands) {
                digest.update(longBytes(operand.length));
                digest.update(operand);
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new FheException("SHA-256 not available", e);
        }
    }

    private static byte[] longBytes(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    private static String key(byte[] handle) {
        return HexFormat.of().formatHex(handle);
    }
}
