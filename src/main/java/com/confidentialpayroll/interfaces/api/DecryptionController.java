package com.confidentialpayroll.interfaces.api;

import com.confidentialpayroll.application.CallerContextProvider;
import com.confidentialpayroll.application.DecryptionProtocolService;
import com.confidentialpayroll.domain.model.DecryptedTotals;
import com.confidentialpayroll.domain.model.DecryptionContext;
import com.confidentialpayroll.interfaces.api.dto.DecryptedTotalsResponse;
import com.confidentialpayroll.interfaces.api.dto.DecryptionCallbackRequest;
import com.confidentialpayroll.interfaces.api.dto.DecryptionContextResponse;
import com.confidentialpayroll.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;
import java.util.List;

/**
 * REST controller for the decryption round trip.
 *
 * The callback endpoint lets an external oracle deliver results over HTTP; it is checked
 * exactly like a callback from the built-in gateway.
 *
 * @author Security Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Decryptions", description = "Committed, proof-checked decryption of batch totals")
@SecurityRequirement(name = "basicAuth")
public class DecryptionController {

    private final DecryptionProtocolService decryptionService;
    private final CallerContextProvider callerContextProvider;

    @PostMapping(value = "/batches/{batchId}/decryptions", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Request batch decryption",
        description = "Aggregates a closed batch, commits to the result and submits it to the decryption oracle"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "202",
            description = "Request accepted; totals arrive asynchronously",
            content = @Content(schema = @Schema(implementation = DecryptionContextResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller is not a data provider",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Batch does not exist or is still open",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "429",
            description = "Decryption request cooldown active",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DecryptionContextResponse> requestDecryption(@PathVariable long batchId) {
        DecryptionContext context = decryptionService.requestBatchDecryption(
            callerContextProvider.getCurrentContext(), batchId);

        if (log.isInfoEnabled()) {
            log.info("Decryption requested via API: batchId={}, requestId={}", batchId, context.getRequestId());
        }

        return ResponseEntity
            .status(HttpStatus.ACCEPTED)
            .body(ResponseMapper.toResponse(context));
    }

    @PostMapping(
        value = "/decryptions/{requestId}/callback",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Deliver decryption result", description = "Oracle only")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Result verified and finalized",
            content = @Content(schema = @Schema(implementation = DecryptedTotalsResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller is not the oracle",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown request id",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Replay, or batch state changed since the request",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Proof rejected or cleartexts malformed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DecryptedTotalsResponse> deliverResult(
            @PathVariable long requestId,
            @Valid @RequestBody DecryptionCallbackRequest request) {

        DecryptedTotals totals = decryptionService.onDecryptionCallback(
            callerContextProvider.getCurrentContext(),
            requestId,
            Base64.getDecoder().decode(request.getCleartexts()),
            Base64.getDecoder().decode(request.getProof())
        );

        return ResponseEntity.ok(ResponseMapper.toResponse(requestId, totals));
    }

    @GetMapping(value = "/decryptions/{requestId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get decryption request")
    public ResponseEntity<DecryptionContextResponse> getDecryption(@PathVariable long requestId) {
        return ResponseEntity.ok(ResponseMapper.toResponse(decryptionService.getDecryptionContext(requestId)));
    }

    @GetMapping(value = "/batches/{batchId}/decryptions", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List decryption requests of a batch")
    public ResponseEntity<List<DecryptionContextResponse>> listDecryptions(@PathVariable long batchId) {
        return ResponseEntity.ok(decryptionService.listDecryptionContexts(batchId).stream()
            .map(ResponseMapper::toResponse)
            .toList());
    }
}
