package com.purchasingpower.contextgraph.api;

import com.purchasingpower.contextgraph.exception.ContextValidationException;
import com.purchasingpower.contextgraph.exception.NodeNotFoundException;
import com.purchasingpower.contextgraph.exception.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions to HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NodeNotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), e.getNodeId());
    }

    @ExceptionHandler(ContextValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ContextValidationException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getField());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError field = e.getBindingResult().getFieldError();
        String subject = field == null ? null : field.getField();
        String message = field == null ? "Invalid request" : field.getField() + " " + field.getDefaultMessage();
        return respond(HttpStatus.BAD_REQUEST, message, subject);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", null);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiError> handlePersistence(PersistenceException e) {
        log.error("Persistent store failure: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message, String subject) {
        return ResponseEntity.status(status)
                .body(ApiError.of(status.value(), status.getReasonPhrase(), message, subject));
    }
}
