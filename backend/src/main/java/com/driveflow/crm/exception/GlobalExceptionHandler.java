package com.driveflow.crm.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        log.warn("[404 NOT_FOUND] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedAccessException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedAccessException ex,
            HttpServletRequest request) {
        log.warn("[403 FORBIDDEN] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorKind.FORBIDDEN, ex.getMessage(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException ex, HttpServletRequest request) {
        log.warn("[403 ACCESS_DENIED] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorKind.FORBIDDEN, "Access denied", request);
    }

    @ExceptionHandler(EvaluationAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleConflict(EvaluationAlreadyExistsException ex,
            HttpServletRequest request) {
        log.warn("[409 CONFLICT] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorKind.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException ex, HttpServletRequest request) {
        log.warn("[400 BAD_REQUEST] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex,
            HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        log.warn("[400 VALIDATION] {} {} — fields: {}", request.getMethod(), request.getRequestURI(), errors);
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT, "Validation failed: " + errors, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {
        log.warn("[400 TYPE_MISMATCH] {} {} — parameter '{}'", request.getMethod(), request.getRequestURI(),
                ex.getName());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT,
                "Invalid value for parameter '" + ex.getName() + "'", request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex,
            HttpServletRequest request) {
        log.warn("[400 MISSING_PARAMETER] {} {} — {}", request.getMethod(), request.getRequestURI(),
                ex.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT,
                "Missing parameter '" + ex.getParameterName() + "'", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        log.warn("[400 UNREADABLE_BODY] {} {}", request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ARGUMENT, "Malformed request body", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception ex, HttpServletRequest request) {
        log.error("[500 INTERNAL_ERROR] {} {} — {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "Internal server error", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorKind kind, String message,
            HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), kind, message, request.getRequestURI()));
    }

    public record ErrorResponse(int status, ErrorKind error, String message, String path, Instant timestamp) {
        public ErrorResponse(int status, ErrorKind error, String message, String path) {
            this(status, error, message, path, Instant.now());
        }
    }
}
