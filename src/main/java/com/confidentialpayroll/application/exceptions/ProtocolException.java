package com.confidentialpayroll.application.exceptions;

import lombok.Getter;

/**
 * Base class of every precondition or verification failure raised by the protocol.
 *
 * <p>Thrown before any state is written, so a failed call leaves no partial mutation.
 */
@Getter
public abstract class ProtocolException extends RuntimeException {

    private final ErrorCode code;

    protected ProtocolException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ProtocolException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
