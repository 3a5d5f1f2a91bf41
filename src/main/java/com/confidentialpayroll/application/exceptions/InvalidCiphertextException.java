package com.confidentialpayroll.application.exceptions;

/**
 * A submitted handle does not refer to a ciphertext the homomorphic library issued.
 */
public class InvalidCiphertextException extends ProtocolException {

    public InvalidCiphertextException(String field, Object identity) {
        super(ErrorCode.INVALID_CIPHERTEXT,
            "Unrecognized " + field + " ciphertext for " + identity);
    }
}
