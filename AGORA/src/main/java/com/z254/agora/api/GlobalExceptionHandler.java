package com.z254.agora.api;

import com.z254.agora.deliberation.InvalidDeliberationRequestException;
import com.z254.agora.job.JobNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions raised at the REST boundary to {@link ApiError} responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Bean validation failure on a request body (HTTP 400).
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex) {
        String details = ex.getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("Rejected request: {}", details);
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * Unreadable body or bad parameter (HTTP 400).
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleInput(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(ex.getClass().getSimpleName(), "Invalid request", ex.getReason(), Instant.now()));
    }

    @ExceptionHandler(InvalidDeliberationRequestException.class)
    public ResponseEntity<ApiError> handleInvalidDeliberation(InvalidDeliberationRequestException ex) {
        log.warn("Invalid deliberation request: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiError(ex.getClass().getSimpleName(), "Invalid deliberation request",
                        ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(JobNotFoundException ex) {
        log.debug("Job lookup missed: {}", ex.getJobId());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiError("JobNotFound", "Job not found", ex.getJobId(), Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError(ex.getClass().getSimpleName(), "Internal server error",
                        "An unexpected error occurred", Instant.now()));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
