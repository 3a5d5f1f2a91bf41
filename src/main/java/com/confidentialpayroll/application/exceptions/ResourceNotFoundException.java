package com.confidentialpayroll.application.exceptions;

/**
 * Read of a batch, record or decryption context that does not exist.
 *
 * <p>Not part of the protocol's failure taxonomy; raised by read operations only.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
