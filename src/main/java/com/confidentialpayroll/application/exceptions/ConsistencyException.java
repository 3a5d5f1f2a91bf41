package com.confidentialpayroll.application.exceptions;

/**
 * Re-derived commitment differs from the one stored at request time.
 */
public class ConsistencyException extends ProtocolException {

    public ConsistencyException(long requestId, long batchId) {
        super(ErrorCode.STATE_MISMATCH,
            "Encrypted state of batch " + batchId + " changed since decryption request " + requestId);
    }
}
