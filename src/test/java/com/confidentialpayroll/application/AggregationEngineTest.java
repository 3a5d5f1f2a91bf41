package com.confidentialpayroll.application;

import com.confidentialpayroll.application.exceptions.ErrorCode;
import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.domain.model.AggregateCiphertexts;
import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.infrastructure.fhe.SymbolicFheCoprocessor;
import com.confidentialpayroll.support.ProtocolTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.confidentialpayroll.support.ProtocolTestFixture.PROVIDER;
import static org.junit.jupiter.api.Assertions.*;

class AggregationEngineTest {

    private ProtocolTestFixture fixture;
    private SymbolicFheCoprocessor fhe;
    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new ProtocolTestFixture();
        fhe = fixture.coprocessor;
        engine = fixture.aggregationEngine;
    }

    @Test
    void folds_contributors_in_insertion_order() {
        long batchId = fixture.openBatch();
        EncryptedRecord a = fixture.submit("alice", 1000, 80);
        EncryptedRecord b = fixture.submit("bob", 2000, 50);
        fixture.closeBatch();

        AggregateCiphertexts aggregate = engine.aggregate(batchId);

        Ciphertext salary = fhe.add(fhe.add(fhe.encryptZero(), a.getSalary()), b.getSalary());
        Ciphertext bonus = fhe.add(
            fhe.add(fhe.encryptZero(), fhe.multiply(a.getSalary(), a.getScore())),
            fhe.multiply(b.getSalary(), b.getScore()));

        assertEquals(batchId, aggregate.batchId());
        assertEquals(salary, aggregate.totalSalary());
        assertEquals(bonus, aggregate.totalBonus());
        assertEquals(2, aggregate.includedContributors());
    }

    @Test
    void aggregation_is_deterministic() {
        long batchId = fixture.openBatch();
        fixture.submit("alice", 1000, 80);
        fixture.submit("bob", 2000, 50);
        fixture.closeBatch();

        assertEquals(engine.aggregate(batchId), engine.aggregate(batchId));
    }

    @Test
    void empty_batch_aggregates_to_encrypted_zero() {
        long batchId = fixture.openBatch();
        fixture.closeBatch();

        AggregateCiphertexts aggregate = engine.aggregate(batchId);

        assertEquals(fhe.encryptZero(), aggregate.totalSalary());
        assertEquals(fhe.encryptZero(), aggregate.totalBonus());
        assertEquals(0, aggregate.includedContributors());
    }

    @Test
    void missing_and_partial_records_are_skipped() {
        long batchId = fixture.openBatch();
        EncryptedRecord alice = fixture.submit("alice", 1000, 80);

        Batch batch = fixture.batches.findById(batchId).orElseThrow();
        batch.addContributor(Identity.of("ghost"));
        batch.addContributor(Identity.of("partial"));
        fixture.records.save(EncryptedRecord.create(Identity.of("partial"),
            Ciphertext.uninitialized(), fixture.encrypt(3), batchId, PROVIDER, fixture.clock.instant()));
        fixture.closeBatch();

        AggregateCiphertexts aggregate = engine.aggregate(batchId);

        assertEquals(1, aggregate.includedContributors());
        assertEquals(fhe.add(fhe.encryptZero(), alice.getSalary()), aggregate.totalSalary());
    }

    @Test
    void unrecognized_handles_are_skipped() {
        long batchId = fixture.openBatch();
        EncryptedRecord alice = fixture.submit("alice", 1000, 80);

        Batch batch = fixture.batches.findById(batchId).orElseThrow();
        batch.addContributor(Identity.of("mallory"));
        fixture.records.save(EncryptedRecord.create(Identity.of("mallory"),
            Ciphertext.of(new byte[32]), fixture.encrypt(3), batchId, PROVIDER, fixture.clock.instant()));
        fixture.closeBatch();

        AggregateCiphertexts aggregate = assertDoesNotThrow(() -> engine.aggregate(batchId));

        assertEquals(1, aggregate.includedContributors());
        assertEquals(fhe.add(fhe.encryptZero(), alice.getSalary()), aggregate.totalSalary());
        assertEquals(fhe.add(fhe.encryptZero(), fhe.multiply(alice.getSalary(), alice.getScore())),
            aggregate.totalBonus());
    }

    @Test
    void contributors_of_the_next_batch_do_not_leak_into_the_previous_one() {
        long first = fixture.openBatch();
        EncryptedRecord a = fixture.submit("alice", 1000, 80);
        EncryptedRecord b = fixture.submit("bob", 2000, 50);

        long second = fixture.openBatch();
        EncryptedRecord c = fixture.submit("carol", 7000, 9);
        fixture.closeBatch();

        AggregateCiphertexts firstAggregate = engine.aggregate(first);
        AggregateCiphertexts secondAggregate = engine.aggregate(second);

        assertEquals(first + 1, second);
        assertEquals(2, firstAggregate.includedContributors());
        assertEquals(fhe.add(fhe.add(fhe.encryptZero(), a.getSalary()), b.getSalary()),
            firstAggregate.totalSalary());
        assertEquals(fhe.add(
                fhe.add(fhe.encryptZero(), fhe.multiply(a.getSalary(), a.getScore())),
                fhe.multiply(b.getSalary(), b.getScore())),
            firstAggregate.totalBonus());

        assertEquals(1, secondAggregate.includedContributors());
        assertEquals(fhe.add(fhe.encryptZero(), c.getSalary()), secondAggregate.totalSalary());
        assertFalse(fixture.batches.findById(first).orElseThrow().hasContributed(Identity.of("carol")));
    }

    @Test
    void open_or_unknown_batch_cannot_be_aggregated() {
        long batchId = fixture.openBatch();

        assertEquals(ErrorCode.INVALID_BATCH,
            assertThrows(LifecycleException.class, () -> engine.aggregate(batchId)).getCode());
        assertEquals(ErrorCode.INVALID_BATCH,
            assertThrows(LifecycleException.class, () -> engine.aggregate(42)).getCode());
    }
}
