package com.confidentialpayroll.infrastructure.security;

import com.confidentialpayroll.domain.model.Identity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable context of one protocol call.
 *
 * <p>Established at the API boundary (or by the oracle gateway) and threaded through every
 * core operation; capability decisions are made against {@link #principal}.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
@Builder
public class CallerContext {
    UUID requestId;
    Identity principal;
    Instant requestedAt;
    String channel;

    public static CallerContext of(Identity principal, Instant at, String channel) {
        return CallerContext.builder()
            .requestId(UUID.randomUUID())
            .principal(principal)
            .requestedAt(at)
            .channel(channel)
            .build();
    }
}
