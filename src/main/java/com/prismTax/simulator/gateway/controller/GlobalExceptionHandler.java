package com.prismTax.simulator.gateway.controller;

import com.prismTax.simulator.classifier.exception.InvalidClassifierContextException;
import com.prismTax.simulator.gateway.exception.MissingPhoneNumberException;
import com.prismTax.simulator.gateway.exception.TurnInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the simulator HTTP surface.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body is malformed or has an unknown value"));
    }

    @ExceptionHandler(MissingPhoneNumberException.class)
    public ResponseEntity<ErrorResponse> handleMissingPhoneNumber(MissingPhoneNumberException ex) {
        log.error("Missing phone number: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MISSING_PHONE_NUMBER", ex.getMessage()));
    }

    @ExceptionHandler(InvalidClassifierContextException.class)
    public ResponseEntity<ErrorResponse> handleInvalidClassifierContext(InvalidClassifierContextException ex) {
        log.warn("Invalid classifier context: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_CLASSIFIER_CONTEXT", ex.getMessage()));
    }

    @ExceptionHandler(TurnInProgressException.class)
    public ResponseEntity<ErrorResponse> handleTurnInProgress(TurnInProgressException ex) {
        log.warn("Turn in progress: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("TURN_IN_PROGRESS", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private record ErrorResponse(String code, String message) {}
}
