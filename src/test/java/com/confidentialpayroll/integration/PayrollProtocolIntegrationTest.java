package com.confidentialpayroll.integration;

import com.confidentialpayroll.interfaces.api.dto.AuditVerificationResponse;
import com.confidentialpayroll.interfaces.api.dto.BatchResponse;
import com.confidentialpayroll.interfaces.api.dto.CiphertextResponse;
import com.confidentialpayroll.interfaces.api.dto.DecryptionContextResponse;
import com.confidentialpayroll.interfaces.api.dto.EncryptInputRequest;
import com.confidentialpayroll.interfaces.api.dto.ErrorResponse;
import com.confidentialpayroll.interfaces.api.dto.SubmitContributionRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PayrollProtocolIntegrationTest {

    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("payroll")
            .withUsername("payroll")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @AfterAll
    void tearDown() {
        postgres.stop();
    }

    @Autowired
    TestRestTemplate restTemplate;

    private TestRestTemplate admin() {
        return restTemplate.withBasicAuth("admin", "admin");
    }

    private TestRestTemplate provider() {
        return restTemplate.withBasicAuth("provider", "provider");
    }

    private String encrypt(long value) {
        ResponseEntity<CiphertextResponse> response = provider().postForEntity(
            "/api/v1/inputs", EncryptInputRequest.builder().value(value).build(), CiphertextResponse.class);
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        return response.getBody().getHandle();
    }

    private void contribute(String identity, long salary, long score) {
        SubmitContributionRequest request = SubmitContributionRequest.builder()
            .identity(identity)
            .salaryHandle(encrypt(salary))
            .scoreHandle(encrypt(score))
            .build();
        assertEquals(HttpStatus.CREATED,
            provider().postForEntity("/api/v1/contributions", request, String.class).getStatusCode());
    }

    private DecryptionContextResponse awaitProcessed(long requestId) throws InterruptedException {
        Instant deadline = Instant.now().plus(Duration.ofSeconds(15));
        while (Instant.now().isBefore(deadline)) {
            DecryptionContextResponse context = provider().getForObject(
                "/api/v1/decryptions/" + requestId, DecryptionContextResponse.class);
            if (context.isProcessed()) {
                return context;
            }
            Thread.sleep(100);
        }
        fail("Decryption request " + requestId + " was not finalized in time");
        return null;
    }

    @Test
    void full_round_trip_releases_verified_totals_and_keeps_ledger_intact() throws Exception {
        ResponseEntity<BatchResponse> opened = admin().postForEntity("/api/v1/batches", null, BatchResponse.class);
        assertEquals(HttpStatus.CREATED, opened.getStatusCode());
        long batchId = opened.getBody().getId();

        contribute("0xAlice", 1000, 80);
        contribute("0xBob", 2000, 50);

        ResponseEntity<ErrorResponse> duplicate = provider().postForEntity("/api/v1/contributions",
            SubmitContributionRequest.builder().identity("0xalice").build(), ErrorResponse.class);
        assertEquals(HttpStatus.CONFLICT, duplicate.getStatusCode());
        assertEquals("DUPLICATE_CONTRIBUTION", duplicate.getBody().getCode());

        ResponseEntity<ErrorResponse> early = provider().postForEntity(
            "/api/v1/batches/" + batchId + "/decryptions", null, ErrorResponse.class);
        assertEquals(HttpStatus.CONFLICT, early.getStatusCode());
        assertEquals("INVALID_BATCH", early.getBody().getCode());

        BatchResponse closed = admin().postForEntity("/api/v1/batches/current/close", null, BatchResponse.class).getBody();
        assertFalse(closed.isOpen());
        assertEquals(2, closed.getContributorCount());

        ResponseEntity<DecryptionContextResponse> requested = provider().postForEntity(
            "/api/v1/batches/" + batchId + "/decryptions", null, DecryptionContextResponse.class);
        assertEquals(HttpStatus.ACCEPTED, requested.getStatusCode());
        assertFalse(requested.getBody().isProcessed());

        DecryptionContextResponse finalized = awaitProcessed(requested.getBody().getRequestId());
        assertEquals("3000", finalized.getTotalSalary());
        assertEquals("180000", finalized.getTotalBonus());
        assertEquals(requested.getBody().getCommitment(), finalized.getCommitment());

        AuditVerificationResponse audit = admin().getForObject("/api/v1/admin/audit/verify", AuditVerificationResponse.class);
        assertTrue(audit.isIntact());
        assertEquals(6, audit.getEntries());
    }

    @Test
    void provider_cannot_manage_batches_and_anonymous_calls_are_refused() {
        ResponseEntity<ErrorResponse> denied = provider().postForEntity("/api/v1/batches", null, ErrorResponse.class);
        assertEquals(HttpStatus.FORBIDDEN, denied.getStatusCode());
        assertEquals("NOT_ADMIN", denied.getBody().getCode());

        assertEquals(HttpStatus.UNAUTHORIZED,
            restTemplate.getForEntity("/api/v1/status", String.class).getStatusCode());
        assertEquals(HttpStatus.OK,
            restTemplate.getForEntity("/actuator/health", String.class).getStatusCode());
    }
}
