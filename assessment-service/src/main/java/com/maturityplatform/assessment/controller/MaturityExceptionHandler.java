package com.maturityplatform.assessment.controller;

import com.maturityplatform.assessment.dto.ErrorResponse;
import com.maturityplatform.common.exception.ConcurrencyException;
import com.maturityplatform.common.exception.NotFoundException;
import com.maturityplatform.common.exception.StateException;
import com.maturityplatform.common.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps engine and service exceptions to HTTP responses. Only concurrency
 * conflicts are marked retryable.
 */
@RestControllerAdvice
public class MaturityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MaturityExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ErrorResponse("validation_error", ex.getMessage(), ex.getViolations(), false));
    }

    @ExceptionHandler(StateException.class)
    public ResponseEntity<ErrorResponse> handleState(StateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("state_error", ex.getMessage(), List.of(), false));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("not_found", ex.getMessage(), List.of(), false));
    }

    @ExceptionHandler(ConcurrencyException.class)
    public ResponseEntity<ErrorResponse> handleConcurrency(ConcurrencyException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("concurrency_conflict", ex.getMessage(), List.of(), true));
    }

    /** Services map stale versions themselves; this covers a write path that does not. */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(OptimisticLockingFailureException ex) {
        log.warn("Unmapped optimistic lock failure. reason={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("concurrency_conflict",
                "The resource was modified concurrently; retry the request", List.of(), true));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse("bad_request", ex.getReason(), List.of(), false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("internal_error", "Unexpected server error", List.of(), false));
    }
}
