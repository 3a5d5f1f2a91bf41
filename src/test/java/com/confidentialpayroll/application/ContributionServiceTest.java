package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.AuthorizationException;
import com.confidentialpayroll.application.exceptions.DuplicateContributionException;
import com.confidentialpayroll.application.exceptions.ErrorCode;
import com.confidentialpayroll.application.exceptions.InvalidCiphertextException;
import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.application.exceptions.RateLimitException;
import com.confidentialpayroll.application.exceptions.ResourceNotFoundException;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.domain.model.ProtocolEvent;
import com.confidentialpayroll.infrastructure.fhe.SymbolicFheCoprocessor;
import com.confidentialpayroll.support.ProtocolTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.confidentialpayroll.support.ProtocolTestFixture.ADMIN;
import static com.confidentialpayroll.support.ProtocolTestFixture.ORACLE;
import static com.confidentialpayroll.support.ProtocolTestFixture.PROVIDER;
import static com.confidentialpayroll.support.ProtocolTestFixture.SECOND_PROVIDER;
import static com.confidentialpayroll.support.ProtocolTestFixture.SUBMISSION_COOLDOWN;
import static org.junit.jupiter.api.Assertions.*;

class ContributionServiceTest {

    private static final Identity ALICE = Identity.of("alice");

    private ProtocolTestFixture fixture;
    private ContributionService service;

    @BeforeEach
    void setUp() {
        fixture = new ProtocolTestFixture();
        service = fixture.contributionService;
    }

    private EncryptedRecord submitAs(Identity provider, Identity identity, Ciphertext salary, Ciphertext score) {
        return service.submitContribution(fixture.as(provider), identity, salary, score);
    }

    @Test
    void accepted_contribution_is_stored_and_enrolled() {
        long batchId = fixture.openBatch();
        Ciphertext salary = fixture.encrypt(1000);
        Ciphertext score = fixture.encrypt(80);

        EncryptedRecord record = submitAs(PROVIDER, ALICE, salary, score);

        assertEquals(ALICE, record.getIdentity());
        assertEquals(salary, record.getSalary());
        assertEquals(score, record.getScore());
        assertEquals(PROVIDER, record.getSubmittedBy());
        assertEquals(List.of(ALICE), fixture.batches.findById(batchId).orElseThrow().getContributors());

        ProtocolEvent.ContributionSubmitted event =
            fixture.events.ofType(ProtocolEvent.ContributionSubmitted.class).get(0);
        assertEquals(ALICE, event.identity());
        assertEquals(batchId, event.batchId());
        assertEquals(salary.toBase64(), event.salaryHandle());
        assertEquals(score.toBase64(), event.scoreHandle());
    }

    @Test
    void uninitialized_inputs_are_coerced_to_encrypted_zero() {
        fixture.openBatch();

        EncryptedRecord record = submitAs(PROVIDER, ALICE, Ciphertext.uninitialized(), fixture.encrypt(5));

        assertTrue(record.isFullyInitialized());
        assertEquals(fixture.coprocessor.encryptZero(), record.getSalary());
        assertEquals(1.0, fixture.meterRegistry.counter("business.contributions.accepted",
            "coerced", "true").count());
    }

    @Test
    void unrecognized_handle_is_rejected_before_any_write() {
        long batchId = fixture.openBatch();

        InvalidCiphertextException ex = assertThrows(InvalidCiphertextException.class,
            () -> submitAs(PROVIDER, ALICE, fixture.encrypt(1000), Ciphertext.of(new byte[32])));

        assertEquals(ErrorCode.INVALID_CIPHERTEXT, ex.getCode());
        assertTrue(fixture.records.findByIdentity(ALICE).isEmpty());
        assertTrue(fixture.batches.findById(batchId).orElseThrow().getContributors().isEmpty());
        assertTrue(fixture.events.ofType(ProtocolEvent.ContributionSubmitted.class).isEmpty());

        // No cooldown was stamped
        assertDoesNotThrow(() -> submitAs(PROVIDER, ALICE, fixture.encrypt(1000), fixture.encrypt(80)));
    }

    @Test
    void handle_from_another_coprocessor_is_rejected() {
        fixture.openBatch();
        Ciphertext foreign = new SymbolicFheCoprocessor().encrypt(1000);

        assertThrows(InvalidCiphertextException.class,
            () -> submitAs(PROVIDER, ALICE, foreign, fixture.encrypt(80)));
    }

    @Test
    void duplicate_contribution_in_same_batch_is_rejected() {
        fixture.openBatch();
        fixture.submit("alice", 1000, 80);

        DuplicateContributionException ex = assertThrows(DuplicateContributionException.class,
            () -> submitAs(SECOND_PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1)));

        assertEquals(ErrorCode.DUPLICATE_CONTRIBUTION, ex.getCode());
        assertEquals(1, fixture.events.ofType(ProtocolEvent.ContributionSubmitted.class).size());
    }

    @Test
    void same_identity_may_contribute_to_next_batch_replacing_its_record() {
        fixture.openBatch();
        fixture.submit("alice", 1000, 80);
        fixture.closeBatch();
        long second = fixture.openBatch();

        Ciphertext newSalary = fixture.encrypt(1200);
        EncryptedRecord record = submitAs(PROVIDER, ALICE, newSalary, fixture.encrypt(85));

        assertEquals(newSalary, record.getSalary());
        assertEquals(second, record.getLastBatchId());
        assertEquals(1, fixture.records.size());
    }

    @Test
    void submission_requires_open_batch() {
        LifecycleException none = assertThrows(LifecycleException.class,
            () -> submitAs(PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1)));
        assertEquals(ErrorCode.INVALID_BATCH, none.getCode());

        fixture.openBatch();
        fixture.closeBatch();
        LifecycleException closed = assertThrows(LifecycleException.class,
            () -> submitAs(PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1)));
        assertEquals(ErrorCode.INVALID_BATCH, closed.getCode());
        assertEquals(0, fixture.records.size());
    }

    @Test
    void submission_requires_provider() {
        fixture.openBatch();

        for (Identity caller : List.of(ADMIN, ORACLE)) {
            AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> submitAs(caller, ALICE, fixture.encrypt(1), fixture.encrypt(1)));
            assertEquals(ErrorCode.NOT_PROVIDER, ex.getCode());
        }
    }

    @Test
    void submission_is_rejected_while_paused() {
        fixture.openBatch();
        fixture.accessControl.pause(fixture.as(ADMIN));

        LifecycleException ex = assertThrows(LifecycleException.class,
            () -> submitAs(PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1)));
        assertEquals(ErrorCode.PAUSED, ex.getCode());
    }

    @Test
    void provider_cooldown_applies_across_identities() {
        fixture.openBatch();
        Instant first = fixture.clock.instant();
        submitAs(PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1));

        RateLimitException ex = assertThrows(RateLimitException.class,
            () -> submitAs(PROVIDER, Identity.of("bob"), fixture.encrypt(2), fixture.encrypt(2)));
        assertEquals(ErrorCode.COOLDOWN_ACTIVE, ex.getCode());
        assertEquals(first.plus(SUBMISSION_COOLDOWN), ex.getRetryAfter());

        // another provider is not affected
        submitAs(SECOND_PROVIDER, Identity.of("bob"), fixture.encrypt(2), fixture.encrypt(2));

        fixture.clock.advance(SUBMISSION_COOLDOWN);
        submitAs(PROVIDER, Identity.of("carol"), fixture.encrypt(3), fixture.encrypt(3));
        assertEquals(3, fixture.batches.findById(1).orElseThrow().getContributorCount());
    }

    @Test
    void rejected_submission_does_not_start_cooldown() {
        fixture.openBatch();
        fixture.submit("alice", 1000, 80);

        assertThrows(DuplicateContributionException.class,
            () -> submitAs(PROVIDER, ALICE, fixture.encrypt(1), fixture.encrypt(1)));

        submitAs(PROVIDER, Identity.of("bob"), fixture.encrypt(2), fixture.encrypt(2));
    }

    @Test
    void encrypt_input_requires_provider() {
        Ciphertext ciphertext = service.encryptInput(fixture.as(PROVIDER), 52_000);
        assertTrue(fixture.coprocessor.isKnown(ciphertext));

        assertThrows(AuthorizationException.class, () -> service.encryptInput(fixture.as(ADMIN), 1));
    }

    @Test
    void record_lookup() {
        fixture.openBatch();
        fixture.submit("Alice", 1000, 80);

        assertEquals(ALICE, service.getRecord(Identity.of("ALICE")).getIdentity());
        assertThrows(ResourceNotFoundException.class, () -> service.getRecord(Identity.of("nobody")));
    }
}
