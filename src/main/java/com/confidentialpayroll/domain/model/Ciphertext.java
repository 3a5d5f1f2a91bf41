package com.confidentialpayroll.domain.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Opaque homomorphic ciphertext.
 *
 * <p>Either {@link #uninitialized()} or a value wrapping an opaque handle issued by the
 * homomorphic library. The handle is never interpreted here; only the library that issued
 * it can operate on it. Instances are immutable.
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class Ciphertext {

    private static final Ciphertext UNINITIALIZED = new Ciphertext(null);

    private final byte[] handle;

    private Ciphertext(byte[] handle) {
        this.handle = handle;
    }

    public static Ciphertext uninitialized() {
        return UNINITIALIZED;
    }

    /**
     * Wraps a library handle.
     *
     * @param handle Handle bytes, must be non-empty
     * @return Initialized ciphertext
     */
    public static Ciphertext of(byte[] handle) {
        if (handle == null || handle.length == 0) {
            throw new IllegalArgumentException("Ciphertext handle must not be empty");
        }
        return new Ciphertext(handle.clone());
    }

    /**
     * Maps a nullable stored column back to a ciphertext.
     */
    public static Ciphertext ofNullable(byte[] handle) {
        return handle == null || handle.length == 0 ? UNINITIALIZED : of(handle);
    }

    public static Ciphertext fromBase64(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return UNINITIALIZED;
        }
        return of(Base64.getDecoder().decode(encoded));
    }

    public boolean isInitialized() {
        return handle != null;
    }

    /**
     * Copy of the handle bytes.
     *
     * @throws IllegalStateException if uninitialized
     */
    public byte[] handle() {
        if (handle == null) {
            throw new IllegalStateException("Uninitialized ciphertext has no handle");
        }
        return handle.clone();
    }

    /**
     * Handle bytes for storage, {@code null} when uninitialized.
     */
    public byte[] handleOrNull() {
        return handle != null ? handle.clone() : null;
    }

    public String toBase64() {
        return handle != null ? Base64.getEncoder().encodeToString(handle) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ciphertext)) {
            return false;
        }
        return Arrays.equals(handle, ((Ciphertext) o).handle);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(handle);
    }

    /**
     * Truncated hex of the handle, safe for logs.
     */
    @Override
    public String toString() {
        if (handle == null) {
            return "Ciphertext[uninitialized]";
        }
        String hex = HexFormat.of().formatHex(handle);
        return "Ciphertext[" + (hex.length() > 16 ? hex.substring(0, 16) + "..." : hex) + "]";
    }
}
