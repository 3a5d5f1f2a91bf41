package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.RateLimitException;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.support.InMemoryCooldownRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CooldownPolicyTest {

    private static final Identity CALLER = Identity.of("provider");
    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    private CooldownPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new CooldownPolicy(new InMemoryCooldownRepository(), Duration.ofSeconds(10), Duration.ofMinutes(1));
    }

    @Test
    void first_call_is_never_limited() {
        assertDoesNotThrow(() -> policy.checkSubmission(CALLER, T0));
        assertDoesNotThrow(() -> policy.checkDecryptionRequest(CALLER, T0));
    }

    @Test
    void call_inside_window_fails_with_retry_time() {
        policy.stampSubmission(CALLER, T0);

        RateLimitException ex = assertThrows(RateLimitException.class,
            () -> policy.checkSubmission(CALLER, T0.plusSeconds(9)));
        assertEquals(T0.plusSeconds(10), ex.getRetryAfter());
    }

    @Test
    void window_boundary_is_inclusive_of_ready_time() {
        policy.stampSubmission(CALLER, T0);

        assertDoesNotThrow(() -> policy.checkSubmission(CALLER, T0.plusSeconds(10)));
    }

    @Test
    void operations_have_independent_windows() {
        policy.stampSubmission(CALLER, T0);

        assertDoesNotThrow(() -> policy.checkDecryptionRequest(CALLER, T0.plusSeconds(1)));

        policy.stampDecryptionRequest(CALLER, T0.plusSeconds(1));
        assertThrows(RateLimitException.class, () -> policy.checkDecryptionRequest(CALLER, T0.plusSeconds(60)));
        assertDoesNotThrow(() -> policy.checkDecryptionRequest(CALLER, T0.plusSeconds(61)));
        assertDoesNotThrow(() -> policy.checkSubmission(CALLER, T0.plusSeconds(11)));
    }

    @Test
    void callers_are_tracked_separately() {
        policy.stampSubmission(CALLER, T0);

        assertDoesNotThrow(() -> policy.checkSubmission(Identity.of("provider-2"), T0));
    }

    @Test
    void zero_cooldown_never_limits() {
        CooldownPolicy unlimited = new CooldownPolicy(new InMemoryCooldownRepository(), Duration.ZERO, Duration.ZERO);
        unlimited.stampSubmission(CALLER, T0);

        assertDoesNotThrow(() -> unlimited.checkSubmission(CALLER, T0));
    }
}
