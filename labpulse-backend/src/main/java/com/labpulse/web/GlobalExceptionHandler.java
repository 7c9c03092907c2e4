package com.labpulse.web;

import com.labpulse.api.ErrorResponse;
import com.labpulse.driver.ConfigurationException;
import com.labpulse.driver.DriverException;
import com.labpulse.persistence.IntegrationNotFoundException;
import com.labpulse.persistence.PersistenceException;
import com.labpulse.poller.IntegrationInactiveException;
import com.labpulse.poller.PollRateLimitedException;
import com.labpulse.poller.PollerBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Malformed request body", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(IntegrationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleIntegrationNotFound(IntegrationNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(ConfigurationException ex) {
        log.warn("Integration misconfigured: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INTEGRATION_MISCONFIGURED", ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(DriverException.class)
    public ResponseEntity<ErrorResponse> handleDriverException(DriverException ex) {
        log.warn("Upstream service error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_ERROR", "Upstream service request failed", ex.getMessage());
    }

    @ExceptionHandler(PollerBusyException.class)
    public ResponseEntity<ErrorResponse> handlePollerBusy(PollerBusyException ex) {
        return respond(HttpStatus.CONFLICT, "POLLER_BUSY", ex.getMessage(), null);
    }

    @ExceptionHandler(IntegrationInactiveException.class)
    public ResponseEntity<ErrorResponse> handleIntegrationInactive(IntegrationInactiveException ex) {
        return respond(HttpStatus.CONFLICT, "INTEGRATION_INACTIVE", ex.getMessage(), null);
    }

    @ExceptionHandler(PollRateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(PollRateLimitedException ex) {
        ErrorResponse error = error("RATE_LIMITED", ex.getMessage(), null);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(ex.getRetryAfterSeconds()))
                .body(error);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceException(PersistenceException ex) {
        log.error("Database error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR", "A database error occurred", ex.getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(error(code, message, details));
    }

    private static ErrorResponse error(String code, String message, String details) {
        return ErrorResponse.of(code, message, details);
    }
}
