package com.helix.scopecheck.controller;

import com.helix.scopecheck.exception.AnalysisUnavailableException;
import com.helix.scopecheck.exception.BudgetExceededException;
import com.helix.scopecheck.exception.ErrorCategory;
import com.helix.scopecheck.exception.InputException;
import com.helix.scopecheck.exception.RefNotFoundException;
import com.helix.scopecheck.exception.ScopeCheckCancelledException;
import com.helix.scopecheck.exception.ScopeCheckException;
import com.helix.scopecheck.model.dto.ScopeCheckResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps the scope check failure taxonomy to HTTP statuses with a JSON error body.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = ScopeCheckController.class)
public class ScopeCheckExceptionHandler {

    @ExceptionHandler(RefNotFoundException.class)
    public ResponseEntity<ScopeCheckResponse> handleRefNotFound(RefNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(InputException.class)
    public ResponseEntity<ScopeCheckResponse> handleInput(InputException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(BudgetExceededException.class)
    public ResponseEntity<ScopeCheckResponse> handleBudget(BudgetExceededException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler(AnalysisUnavailableException.class)
    public ResponseEntity<ScopeCheckResponse> handleUnavailable(AnalysisUnavailableException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(ScopeCheckCancelledException.class)
    public ResponseEntity<ScopeCheckResponse> handleCancelled(ScopeCheckCancelledException ex) {
        log.info("Scope check cancelled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ScopeCheckResponse.error("CANCELLED", ex.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    public ResponseEntity<ScopeCheckResponse> handleInvalidRequest(Exception ex) {
        String message = ex instanceof MethodArgumentNotValidException invalid
                ? invalid.getBindingResult().getFieldErrors().stream()
                        .map(FieldError::getDefaultMessage)
                        .collect(Collectors.joining("; "))
                : ex.getMessage();
        log.warn("Rejected scope check request: {}", message);
        return ResponseEntity.badRequest()
                .body(ScopeCheckResponse.error(ErrorCategory.INPUT_ERROR.name(), message));
    }

    private ResponseEntity<ScopeCheckResponse> respond(HttpStatus status, ScopeCheckException ex) {
        if (status.is5xxServerError()) {
            log.error("Scope check failed ({}): {}", ex.getCategory(), ex.getMessage());
        } else {
            log.warn("Scope check rejected ({}): {}", ex.getCategory(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(ScopeCheckResponse.error(ex.getCategory().name(), ex.getMessage()));
    }
}
