package dev.cvevaluator.controller;

import dev.cvevaluator.controller.dto.ErrorResponse;
import dev.cvevaluator.exception.DocumentNotFoundException;
import dev.cvevaluator.exception.EvaluationException;
import dev.cvevaluator.exception.JobNotFoundException;
import dev.cvevaluator.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps errors raised by the HTTP surface to status codes and a small JSON body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage()));
    }

    /**
     * Malformed JSON, missing body or unreadable multipart request.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ValidationException.CODE, "Malformed request: " + ex.getReason()));
    }

    @ExceptionHandler({JobNotFoundException.class, DocumentNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(EvaluationException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(EvaluationException.INTERNAL_ERROR, "An unexpected error occurred"));
    }
}
