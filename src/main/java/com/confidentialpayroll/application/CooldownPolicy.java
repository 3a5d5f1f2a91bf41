package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.RateLimitException;
import com.confidentialpayroll.config.ProtocolProperties;
import com.confidentialpayroll.domain.model.CooldownState;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.repository.CooldownRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-caller rate limits for submissions and decryption requests.
 *
 * <p>A gated call made before {@code last + cooldown} fails; it never waits. A call made at
 * exactly {@code last + cooldown} is allowed.
 */
@Component
@Slf4j
public class CooldownPolicy {

    static final String SUBMISSION = "submitContribution";
    static final String DECRYPTION_REQUEST = "requestBatchDecryption";

    private final CooldownRepository repository;
    private final Duration submissionCooldown;
    private final Duration decryptionRequestCooldown;

    @Autowired
    public CooldownPolicy(CooldownRepository repository, ProtocolProperties properties) {
        this(
            repository,
            properties.getProtocol().getSubmissionCooldown(),
            properties.getProtocol().getDecryptionRequestCooldown()
        );
    }

    public CooldownPolicy(CooldownRepository repository, Duration submissionCooldown, Duration decryptionRequestCooldown) {
        this.repository = repository;
        this.submissionCooldown = submissionCooldown;
        this.decryptionRequestCooldown = decryptionRequestCooldown;
    }

    public void checkSubmission(Identity caller, Instant now) {
        Optional<Instant> last = repository.findByIdentity(caller).flatMap(CooldownState::getLastSubmissionAt);
        check(SUBMISSION, caller, last, submissionCooldown, now);
    }

    public void checkDecryptionRequest(Identity caller, Instant now) {
        Optional<Instant> last = repository.findByIdentity(caller).flatMap(CooldownState::getLastDecryptionRequestAt);
        check(DECRYPTION_REQUEST, caller, last, decryptionRequestCooldown, now);
    }

    public void stampSubmission(Identity caller, Instant now) {
        CooldownState state = load(caller);
        state.stampSubmission(now);
        repository.save(state);
    }

    public void stampDecryptionRequest(Identity caller, Instant now) {
        CooldownState state = load(caller);
        state.stampDecryptionRequest(now);
        repository.save(state);
    }

    private CooldownState load(Identity caller) {
        return repository.findByIdentity(caller).orElseGet(() -> new CooldownState(caller));
    }

    private static void check(String operation, Identity caller, Optional<Instant> last, Duration cooldown, Instant now) {
        if (last.isEmpty()) {
            return;
        }
        Instant readyAt = last.get().plus(cooldown);
        if (now.isBefore(readyAt)) {
            log.warn("Cooldown active: operation={}, caller={}, retryAfter={}", operation, caller, readyAt);
            throw new RateLimitException(operation, caller, readyAt);
        }
    }
}
