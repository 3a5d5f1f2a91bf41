package com.confidentialpayroll.application.exceptions;

import lombok.Getter;

import java.time.Instant;

/**
 * Cooldown has not elapsed. The call fails rather than waits.
 */
@Getter
public class RateLimitException extends ProtocolException {

    private final Instant retryAfter;

    public RateLimitException(String operation, Object caller, Instant retryAfter) {
        super(ErrorCode.COOLDOWN_ACTIVE,
            "Cooldown active for " + operation + " by " + caller + " until " + retryAfter);
        this.retryAfter = retryAfter;
    }
}
