package com.confidentialpayroll.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import org.owasp.encoder.Encode;

import java.util.Locale;
import java.util.Objects;

/**
 * Opaque principal key (e.g. an account address).
 *
 * <p>Values are trimmed and lower-cased so that the same address written with
 * different hex casing maps to one identity. Only letters, digits and {@code . _ : @ -}
 * are accepted.
 */
public record Identity(@JsonValue String value) implements Comparable<Identity> {

    private static final String ALLOWED = "^[a-z0-9._:@-]+$";

    public Identity {
        Objects.requireNonNull(value, "Identity value must not be null");
        value = value.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Identity value must not be blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("Identity value too long (max 128 characters)");
        }
        // Restricted alphabet (prevent log injection)
        if (!value.matches(ALLOWED)) {
            throw new IllegalArgumentException("Invalid identity: " + Encode.forJava(value));
        }
    }

    public static Identity of(String value) {
        return new Identity(value);
    }

    @Override
    public int compareTo(Identity other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
