package com.eainde.atlas.controller;

import com.eainde.atlas.error.FailureKind;
import com.eainde.atlas.error.PersistenceException;
import com.eainde.atlas.error.RunFailedException;
import com.eainde.atlas.workflow.PlanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = PlanController.class)
public class AgentExceptionHandler {

    @ExceptionHandler(RunFailedException.class)
    public ResponseEntity<ErrorResponse> handleRunFailed(RunFailedException ex) {
        HttpStatus status = statusOf(ex.getKind());
        log.warn("[API] Run {} failed ({}): {}", ex.getRunId(), ex.getKind(), ex.getMessage());
        ErrorResponse body = new ErrorResponse(ex.getKind().name(), ex.getMessage(), ex.getRunId(),
                ex.getSnapshot() != null ? ex.getSnapshot().nodeEvents() : null);
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException ex) {
        log.error("[API] Persistence failure: {}", ex.getMessage());
        ErrorResponse body = new ErrorResponse(FailureKind.PERSISTENCE.name(), ex.getMessage(),
                ex.getResult().map(PlanResult::runId).orElse(null),
                ex.getResult().map(PlanResult::timeline).orElse(null));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", ex.getMessage()));
    }

    static HttpStatus statusOf(FailureKind kind) {
        return switch (kind) {
            case REASONING_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case MAX_ITERATIONS_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
