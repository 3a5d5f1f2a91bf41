package com.confidentialpayroll.application.exceptions;

/**
 * Protocol or batch is in the wrong state for the requested operation.
 */
public class LifecycleException extends ProtocolException {

    public LifecycleException(ErrorCode code, String message) {
        super(code, message);
    }

    public static LifecycleException paused() {
        return new LifecycleException(ErrorCode.PAUSED, "Protocol is paused");
    }

    public static LifecycleException invalidBatch(String message) {
        return new LifecycleException(ErrorCode.INVALID_BATCH, message);
    }

    public static LifecycleException invalidBatchState(String message) {
        return new LifecycleException(ErrorCode.INVALID_BATCH_STATE, message);
    }

    public static LifecycleException unknownRequest(long requestId) {
        return new LifecycleException(ErrorCode.UNKNOWN_REQUEST, "Unknown decryption request: " + requestId);
    }
}
