package com.confidentialpayroll.interfaces.api.exception;

import com.confidentialpayroll.application.exceptions.AuthorizationException;
import com.confidentialpayroll.application.exceptions.ErrorCode;
import com.confidentialpayroll.application.exceptions.ProtocolException;
import com.confidentialpayroll.application.exceptions.RateLimitException;
import com.confidentialpayroll.application.exceptions.ResourceNotFoundException;
import com.confidentialpayroll.infrastructure.fhe.FheException;
import com.confidentialpayroll.interfaces.api.dto.ErrorResponse;
import jakarta.persistence.OptimisticLockException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Every protocol failure maps to its own HTTP status and an {@link ErrorResponse} whose
 * {@code code} names the cause:
 * - NOT_ADMIN, NOT_PROVIDER, NOT_ORACLE: 403
 * - PAUSED: 503
 * - COOLDOWN_ACTIVE: 429 with Retry-After
 * - UNKNOWN_REQUEST: 404
 * - INVALID_BATCH, INVALID_BATCH_STATE, DUPLICATE_CONTRIBUTION, REPLAY_ATTEMPT, STATE_MISMATCH: 409
 * - PROOF_VERIFICATION_FAILED, MALFORMED_CLEARTEXTS, INVALID_CIPHERTEXT: 422
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    /**
     * Handle validation errors from @Valid annotation.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getBindingResult()
            .getAllErrors()
            .stream()
            .map(error -> {
                String fieldName = error instanceof FieldError
                    ? ((FieldError) error).getField()
                    : error.getObjectName();

                return ErrorResponse.ValidationError.builder()
                    .field(fieldName)
                    .message(error.getDefaultMessage())
                    .build();
            })
            .collect(Collectors.toList());

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Validation Failed", request)
            .code("VALIDATION_FAILED")
            .message("Invalid request parameters")
            .validationErrors(validationErrors)
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Validation error: {} validation failures on {}",
                validationErrors.size(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle cooldown violations.
     */
    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(
            RateLimitException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", request)
            .code(ex.getCode().name())
            .message(ex.getMessage())
            .retryAfter(ex.getRetryAfter())
            .build();

        long retryAfterSeconds = Math.max(1, Duration.between(clock.instant(), ex.getRetryAfter()).toSeconds());

        if (log.isWarnEnabled()) {
            log.warn("Cooldown active on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds))
            .body(errorResponse);
    }

    /**
     * Handle capability denials.
     */
    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(
            AuthorizationException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.FORBIDDEN, "Access Denied", request)
            .code(ex.getCode().name())
            .message(ex.getMessage())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Access denied: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorResponse);
    }

    /**
     * Handle all other protocol failures.
     */
    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<ErrorResponse> handleProtocol(
            ProtocolException ex,
            HttpServletRequest request) {

        HttpStatus status = statusOf(ex.getCode());
        ErrorResponse errorResponse = baseResponse(status, status.getReasonPhrase(), request)
            .code(ex.getCode().name())
            .message(ex.getMessage())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Protocol rejection: code={}, message={} on {}",
                ex.getCode(), ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler({ResourceNotFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.NOT_FOUND, "Not Found", request)
            .code("NOT_FOUND")
            .message(ex.getMessage())
            .build();

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * Handle ciphertexts the homomorphic library cannot operate on.
     */
    @ExceptionHandler(FheException.class)
    public ResponseEntity<ErrorResponse> handleFhe(
            FheException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Ciphertext", request)
            .code("CIPHERTEXT_REJECTED")
            .message(ex.getMessage())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Homomorphic operation failed on {}: {}", request.getRequestURI(), ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(errorResponse);
    }

    /**
     * Handle optimistic locking failures.
     */
    @ExceptionHandler(OptimisticLockException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            OptimisticLockException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT, "Concurrent Modification", request)
            .code("CONCURRENT_MODIFICATION")
            .message("The resource was modified by another request. Please retry.")
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Optimistic lock exception on {}", request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * Handle malformed identities, handles and path variables.
     */
    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Bad Request", request)
            .code("BAD_REQUEST")
            .message("Invalid request: " + ex.getMessage())
            .build();

        if (log.isWarnEnabled()) {
            log.warn("Bad request: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle security exceptions.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ErrorResponse> handleSecurityException(
            SecurityException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.UNAUTHORIZED, "Unauthorized", request)
            .code("UNAUTHENTICATED")
            .message("Authentication required")
            .build();

        if (log.isErrorEnabled()) {
            log.error("Security exception: {} on {}", ex.getMessage(), request.getRequestURI());
        }

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
    }

    /**
     * Handle all other exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", request)
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred. Please contact support.")
            .build();

        if (log.isErrorEnabled()) {
            log.error("Unhandled exception on {}: {}",
                request.getRequestURI(), ex.getMessage(), ex);
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case NOT_ADMIN:
            case NOT_PROVIDER:
            case NOT_ORACLE:
                return HttpStatus.FORBIDDEN;
            case PAUSED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case COOLDOWN_ACTIVE:
                return HttpStatus.TOO_MANY_REQUESTS;
            case UNKNOWN_REQUEST:
                return HttpStatus.NOT_FOUND;
            case PROOF_VERIFICATION_FAILED:
            case MALFORMED_CLEARTEXTS:
            case INVALID_CIPHERTEXT:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.CONFLICT;
        }
    }

    private ErrorResponse.ErrorResponseBuilder baseResponse(
            HttpStatus status,
            String error,
            HttpServletRequest request) {

        return ErrorResponse.builder()
            .requestId(UUID.randomUUID())
            .timestamp(clock.instant())
            .status(status.value())
            .error(error)
            .path(request.getRequestURI());
    }
}
