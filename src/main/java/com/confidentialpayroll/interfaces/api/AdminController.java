package com.confidentialpayroll.interfaces.api;

import com.confidentialpayroll.application.CallerContextProvider;
import com.confidentialpayroll.application.ProtocolAdministrationService;
import com.confidentialpayroll.application.ProtocolAdministrationService.ProtocolStatus;
import com.confidentialpayroll.infrastructure.audit.AuditChainVerifier.VerificationResult;
import com.confidentialpayroll.infrastructure.security.AccessControl;
import com.confidentialpayroll.infrastructure.security.CallerContext;
import com.confidentialpayroll.interfaces.api.dto.AuditVerificationResponse;
import com.confidentialpayroll.interfaces.api.dto.ProtocolStatusResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

/**
 * Pause control, status and audit ledger verification.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Administration", description = "Pause control and protocol status")
@SecurityRequirement(name = "basicAuth")
public class AdminController {

    private final ProtocolAdministrationService administrationService;
    private final AccessControl accessControl;
    private final CallerContextProvider callerContextProvider;

    @PostMapping(value = "/admin/pause", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Pause the protocol", description = "Admin only; the oracle callback is not paused")
    public ResponseEntity<ProtocolStatusResponse> pause() {
        CallerContext caller = callerContextProvider.getCurrentContext();
        administrationService.pause(caller);

        if (log.isWarnEnabled()) {
            log.warn("Protocol paused via API by {}", caller.getPrincipal());
        }

        return ResponseEntity.ok(toResponse(caller, administrationService.status()));
    }

    @PostMapping(value = "/admin/unpause", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Unpause the protocol", description = "Admin only")
    public ResponseEntity<ProtocolStatusResponse> unpause() {
        CallerContext caller = callerContextProvider.getCurrentContext();
        administrationService.unpause(caller);

        if (log.isWarnEnabled()) {
            log.warn("Protocol unpaused via API by {}", caller.getPrincipal());
        }

        return ResponseEntity.ok(toResponse(caller, administrationService.status()));
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Protocol status", description = "Availability, current batch and the caller's capabilities")
    public ResponseEntity<ProtocolStatusResponse> status() {
        CallerContext caller = callerContextProvider.getCurrentContext();
        return ResponseEntity.ok(toResponse(caller, administrationService.status()));
    }

    @GetMapping(value = "/admin/audit/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Verify audit ledger", description = "Admin only; re-hashes every ledger entry")
    public ResponseEntity<AuditVerificationResponse> verifyAuditLedger() {
        VerificationResult result = administrationService.verifyAuditLedger(callerContextProvider.getCurrentContext());
        return ResponseEntity.ok(AuditVerificationResponse.builder()
            .intact(result.intact())
            .entries(result.entries())
            .firstBrokenSequence(result.firstBrokenSequence())
            .build());
    }

    private ProtocolStatusResponse toResponse(CallerContext caller, ProtocolStatus status) {
        return ProtocolStatusResponse.builder()
            .available(status.available())
            .paused(status.paused())
            .currentBatchId(status.currentBatchId())
            .currentBatchOpen(status.currentBatchOpen())
            .stalledDecryptions(status.stalledDecryptions())
            .caller(caller.getPrincipal().value())
            .capabilities(new ArrayList<>(accessControl.capabilitiesOf(caller.getPrincipal())))
            .build();
    }
}
