package com.confidentialpayroll.application;

import com.confidentialpayroll.config.ProtocolProperties;
import com.confidentialpayroll.domain.model.AggregateCiphertexts;
import com.confidentialpayroll.domain.model.Ciphertext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Binding hash of the ciphertexts handed to the decryption oracle.
 *
 * <p>{@code SHA-256(len(h1) || h1 || len(h2) || h2 || instanceId)}, with each length a 4-byte
 * big-endian prefix. The instance id ties the commitment to one deployment.
 */
@Component
public class CommitmentCalculator {

    private final byte[] instanceId;

    @Autowired
    public CommitmentCalculator(ProtocolProperties properties) {
        this(properties.getProtocol().getInstanceId());
    }

    public CommitmentCalculator(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("Protocol instance id must be set");
        }
        this.instanceId = instanceId.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] commit(AggregateCiphertexts aggregate) {
        return commit(aggregate.asList());
    }

    public byte[] commit(List<Ciphertext> ciphertexts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Ciphertext ciphertext : ciphertexts) {
                byte[] handle = ciphertext.handle();
                digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(handle.length).array());
                digest.update(handle);
            }
            digest.update(instanceId);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Constant-time comparison.
     */
    public boolean matches(byte[] expected, byte[] actual) {
        return MessageDigest.isEqual(expected, actual);
    }
}
