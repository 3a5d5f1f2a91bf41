package com.confidentialpayroll.infrastructure.fhe;

import com.confidentialpayroll.domain.model.Ciphertext;

import java.util.List;

/**
 * External decryption network.
 *
 * <p>{@link #requestDecryption} returns immediately; the result arrives later and out of
 * band through {@link DecryptionResultListener}. Results must be checked with
 * {@link #verifyProof} before they are trusted.
 */
public interface DecryptionOracle {

    /**
     * Submit ciphertexts for decryption.
     *
     * @return Request id the callback will carry
     */
    long requestDecryption(List<Ciphertext> ciphertexts);

    /**
     * Check that {@code proof} attests {@code cleartexts} as the decryption for the request.
     */
    boolean verifyProof(long requestId, byte[] cleartexts, byte[] proof);
}
