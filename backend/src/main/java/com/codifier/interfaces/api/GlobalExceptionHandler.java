package com.codifier.interfaces.api;

import com.codifier.application.act.exception.ActNotFoundException;
import com.codifier.application.amendment.exception.AmendmentNotFoundException;
import com.codifier.application.apply.exception.ApplyPreconditionException;
import com.codifier.application.apply.exception.VersionConflictException;
import com.codifier.application.review.exception.ChangeConflictException;
import com.codifier.application.review.exception.ChangeNotFoundException;
import com.codifier.application.review.exception.ChangeSetNotFoundException;
import com.codifier.application.review.exception.InvalidTransitionException;
import com.codifier.application.review.exception.StaleReviewException;
import com.codifier.infrastructure.ai.LlmCallException;
import com.codifier.infrastructure.apply.ChangeApplicationException;
import com.codifier.infrastructure.extraction.ExtractionException;
import com.codifier.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({ActNotFoundException.class, AmendmentNotFoundException.class,
            ChangeSetNotFoundException.class, ChangeNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ChangeConflictException.class)
    public ResponseEntity<ErrorResponse> handleChangeConflict(ChangeConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("CONFLICT", e.getMessage(),
                        Map.of("changeId", e.getChangeId(), "conflictingChangeId", e.getConflictingChangeId())));
    }

    @ExceptionHandler(StaleReviewException.class)
    public ResponseEntity<ErrorResponse> handleStaleReview(StaleReviewException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("STALE_REVIEW", e.getMessage(),
                        Map.of("changeId", e.getChangeId(), "currentState", e.getCurrentState())));
    }

    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> handleVersionConflict(VersionConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("VERSION_CONFLICT", e.getMessage(),
                        Map.of("documentId", e.getDocumentId(),
                                "expectedVersion", e.getExpectedVersion(),
                                "headVersion", e.getHeadVersion())));
    }

    @ExceptionHandler(ChangeApplicationException.class)
    public ResponseEntity<ErrorResponse> handleChangeApplication(ChangeApplicationException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getCode(), e.getMessage(), Map.of("changeId", e.getChangeId())));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("INVALID_TRANSITION", e.getMessage()));
    }

    @ExceptionHandler(ApplyPreconditionException.class)
    public ResponseEntity<ErrorResponse> handleApplyPrecondition(ApplyPreconditionException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler({ExtractionException.class, LlmCallException.class})
    public ResponseEntity<ErrorResponse> handleExtraction(RuntimeException e) {
        log.warn("[GlobalExceptionHandler] Extraction unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("EXTRACTION_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error, please retry later"));
    }
}
