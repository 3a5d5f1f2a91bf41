package com.confidentialpayroll.application.exceptions;

/**
 * Callback for a decryption request that was already finalized.
 */
public class ReplayException extends ProtocolException {

    public ReplayException(long requestId) {
        super(ErrorCode.REPLAY_ATTEMPT, "Decryption request " + requestId + " was already processed");
    }
}
