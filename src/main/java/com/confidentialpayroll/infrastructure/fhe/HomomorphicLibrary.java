package com.confidentialpayroll.infrastructure.fhe;

import com.confidentialpayroll.domain.model.Ciphertext;

/**
 * Homomorphic encryption operations consumed by the protocol.
 *
 * <p>Implementations must be deterministic for {@link #encryptZero()}, {@link #add} and
 * {@link #multiply}: the same operands always yield the same ciphertext. Aggregation
 * commitments rely on this to be re-derivable at callback time.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface HomomorphicLibrary {

    /**
     * Deterministic encryption of zero, the additive identity.
     */
    Ciphertext encryptZero();

    /**
     * Encrypt a client input. Produces a fresh ciphertext on every call.
     *
     * @param plaintext Unsigned 64-bit value
     */
    Ciphertext encrypt(long plaintext);

    boolean isInitialized(Ciphertext ciphertext);

    /**
     * Whether the handle was issued by this library, so that {@link #add} and
     * {@link #multiply} can operate on it.
     */
    boolean isKnown(Ciphertext ciphertext);

    Ciphertext add(Ciphertext lhs, Ciphertext rhs);

    Ciphertext multiply(Ciphertext lhs, Ciphertext rhs);
}
