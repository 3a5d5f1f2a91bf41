package com.confidentialpayroll.application.exceptions;

/**
 * Oracle-supplied result could not be accepted.
 */
public class ProofVerificationException extends ProtocolException {

    public ProofVerificationException(ErrorCode code, String message) {
        super(code, message);
    }

    public ProofVerificationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static ProofVerificationException invalidProof(long requestId) {
        return new ProofVerificationException(ErrorCode.PROOF_VERIFICATION_FAILED,
            "Decryption proof rejected for request " + requestId);
    }

    public static ProofVerificationException malformedCleartexts(long requestId, Throwable cause) {
        return new ProofVerificationException(ErrorCode.MALFORMED_CLEARTEXTS,
            "Cleartexts for request " + requestId + " cannot be decoded", cause);
    }
}
