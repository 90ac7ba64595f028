package com.phillippitts.champ.presentation.exception;

import com.phillippitts.champ.exception.ChampException;
import com.phillippitts.champ.exception.LedgerException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST boundary.
 *
 * Converts domain exceptions to HTTP responses; details stay in the logs.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(LedgerException.class)
    ResponseEntity<ApiError> handleLedgerFailure(LedgerException ex) {
        LOG.error("Ledger failure: entry={}", ex.getEntryPath(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Round ledger unavailable",
                "Check ledger storage and retry",
                Instant.now()
            ));
    }

    /**
     * Other domain failures are treated as transient (HTTP 503).
     */
    @ExceptionHandler(ChampException.class)
    ResponseEntity<ApiError> handleDomainFailure(ChampException ex) {
        LOG.error("Request failed: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Error body returned to API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
