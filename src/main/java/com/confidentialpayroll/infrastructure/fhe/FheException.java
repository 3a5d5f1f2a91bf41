package com.confidentialpayroll.infrastructure.fhe;

/**
 * Exception thrown when a homomorphic or oracle operation fails.
 */
public class FheException extends RuntimeException {

    public FheException(String message) {
        super(message);
    }

    public FheException(String message, Throwable cause) {
        super(message, cause);
    }
}
