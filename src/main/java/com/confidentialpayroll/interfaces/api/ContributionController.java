package com.confidentialpayroll.interfaces.api;

import com.confidentialpayroll.application.CallerContextProvider;
import com.confidentialpayroll.application.ContributionService;
import com.confidentialpayroll.domain.model.Ciphertext;
import com.confidentialpayroll.domain.model.EncryptedRecord;
import com.confidentialpayroll.domain.model.Identity;
import com.confidentialpayroll.interfaces.api.dto.CiphertextResponse;
import com.confidentialpayroll.interfaces.api.dto.EncryptInputRequest;
import com.confidentialpayroll.interfaces.api.dto.EncryptedRecordResponse;
import com.confidentialpayroll.interfaces.api.dto.ErrorResponse;
import com.confidentialpayroll.interfaces.api.dto.SubmitContributionRequest;
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

/**
 * REST controller for client input encryption, contribution submission and record reads.
 *
 * Security:
 * - Plaintext inputs are never logged
 * - Responses carry ciphertext handles only
 *
 * @author Security Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Contributions", description = "Encrypted contribution submission")
@SecurityRequirement(name = "basicAuth")
public class ContributionController {

    private final ContributionService contributionService;
    private final CallerContextProvider callerContextProvider;

    @PostMapping(
        value = "/inputs",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Encrypt input",
        description = "Encrypts a plaintext value and returns its ciphertext handle"
    )
    public ResponseEntity<CiphertextResponse> encryptInput(@Valid @RequestBody EncryptInputRequest request) {
        Ciphertext ciphertext = contributionService.encryptInput(
            callerContextProvider.getCurrentContext(), request.getValue());

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ResponseMapper.toResponse(ciphertext));
    }

    /**
     * Submit a contribution into the current batch.
     *
     * @param request Contributor identity and Base64 ciphertext handles
     * @return Stored record
     */
    @PostMapping(
        value = "/contributions",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Submit contribution",
        description = "Stores an encrypted (salary, score) pair and adds the contributor to the current batch"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Contribution accepted",
            content = @Content(schema = @Schema(implementation = EncryptedRecordResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller is not a data provider",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "No open batch, or contributor already in the current batch",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "429",
            description = "Submission cooldown active",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<EncryptedRecordResponse> submitContribution(
            @Valid @RequestBody SubmitContributionRequest request) {

        Identity identity = Identity.of(request.getIdentity());

        if (log.isInfoEnabled()) {
            log.info("Submitting contribution for {}", identity);
        }

        EncryptedRecord record = contributionService.submitContribution(
            callerContextProvider.getCurrentContext(),
            identity,
            Ciphertext.fromBase64(request.getSalaryHandle()),
            Ciphertext.fromBase64(request.getScoreHandle())
        );

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ResponseMapper.toResponse(record));
    }

    @GetMapping(value = "/records/{identity}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get encrypted record", description = "Returns the stored ciphertext handles of a contributor")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Record found",
            content = @Content(schema = @Schema(implementation = EncryptedRecordResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "No record for this identity",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<EncryptedRecordResponse> getRecord(@PathVariable String identity) {
        return ResponseEntity.ok(ResponseMapper.toResponse(contributionService.getRecord(Identity.of(identity))));
    }
}
