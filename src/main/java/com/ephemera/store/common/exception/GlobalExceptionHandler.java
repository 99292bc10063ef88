package com.ephemera.store.common.exception;

import com.ephemera.store.common.Result;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BaseStoreException.class)
    public ResponseEntity<Http.ErrorResponse> handleBaseStoreException(BaseStoreException ex) {
        log.warn("Application exception: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return Http.from(Result.fail(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Http.ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return Http.error(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-SYS-001", "An unexpected error occurred");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Http.ErrorResponse> handleDataAccessException(DataAccessException ex) {
        log.error("Database error", ex);
        return Http.error(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-DB-002", "Database operation failed");
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Http.ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-VAL-002", ex.getMessage());
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<Http.ErrorResponse> handleHandlerMethodValidation(HandlerMethodValidationException ex) {
        String errorMessage = ex.getAllValidationResults().stream()
                .flatMap(r -> r.getResolvableErrors().stream()
                        .map(e -> r.getMethodParameter().getParameterName() + ": " + e.getDefaultMessage()))
                .reduce((error1, error2) -> error1 + ", " + error2)
                .orElse("Validation failed");
        log.warn("Validation error: {}", errorMessage);
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-VAL-002", errorMessage);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Http.ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((error1, error2) -> error1 + ", " + error2)
                .orElse("Validation failed");

        log.warn("Validation error: {}", errorMessage);
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-VAL-003", errorMessage);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Http.ErrorResponse> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request payload: {}", ex.getMessage());
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-REQ-001", "Malformed request payload");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Http.ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        log.warn("Method not supported: {}", ex.getMessage());
        return Http.error(HttpStatus.METHOD_NOT_ALLOWED, "ERR-REQ-002", ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Http.ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getMessage());
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-REQ-003", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Http.ErrorResponse> handleArgumentTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch for parameter {}: {}", ex.getName(), ex.getMessage());
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-REQ-004", "Invalid value for parameter: " + ex.getName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Http.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return Http.error(HttpStatus.BAD_REQUEST, "ERR-VAL-001", ex.getMessage());
    }
}
