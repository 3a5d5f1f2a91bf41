package com.confidentialpayroll.interfaces.api;

import com.confidentialpayroll.application.BatchLifecycleService;
import com.confidentialpayroll.application.CallerContextProvider;
import com.confidentialpayroll.domain.model.Batch;
import com.confidentialpayroll.interfaces.api.dto.BatchResponse;
import com.confidentialpayroll.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the batch lifecycle.
 *
 * Opening and closing require the admin capability; reads only require authentication.
 *
 * @author Security Team
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/batches")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Batches", description = "Batch lifecycle operations")
@SecurityRequirement(name = "basicAuth")
public class BatchController {

    private final BatchLifecycleService batchService;
    private final CallerContextProvider callerContextProvider;

    /**
     * Open the next batch.
     *
     * @return The new open batch
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Open next batch",
        description = "Opens batch currentBatchId + 1; a still-open current batch is closed first"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Batch opened",
            content = @Content(schema = @Schema(implementation = BatchResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller is not an admin",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Protocol is paused",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<BatchResponse> openBatch() {
        Batch batch = batchService.openBatch(callerContextProvider.getCurrentContext());

        if (log.isInfoEnabled()) {
            log.info("Batch opened via API: id={}", batch.getId());
        }

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ResponseMapper.toResponse(batch));
    }

    /**
     * Close the current batch.
     */
    @PostMapping(value = "/current/close", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Close current batch", description = "Freezes the current batch")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Batch closed",
            content = @Content(schema = @Schema(implementation = BatchResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Caller is not an admin",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "No batch or current batch already closed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<BatchResponse> closeBatch() {
        Batch batch = batchService.closeBatch(callerContextProvider.getCurrentContext());

        if (log.isInfoEnabled()) {
            log.info("Batch closed via API: id={}", batch.getId());
        }

        return ResponseEntity.ok(ResponseMapper.toResponse(batch));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List batches")
    public ResponseEntity<List<BatchResponse>> listBatches() {
        return ResponseEntity.ok(batchService.listBatches().stream()
            .map(ResponseMapper::toResponse)
            .toList());
    }

    @GetMapping(value = "/current", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get current batch")
    public ResponseEntity<BatchResponse> getCurrentBatch() {
        return ResponseEntity.ok(ResponseMapper.toResponse(batchService.getCurrentBatch()));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get batch by id")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Batch found",
            content = @Content(schema = @Schema(implementation = BatchResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Batch not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<BatchResponse> getBatch(@PathVariable long id) {
        return ResponseEntity.ok(ResponseMapper.toResponse(batchService.getBatch(id)));
    }
}
