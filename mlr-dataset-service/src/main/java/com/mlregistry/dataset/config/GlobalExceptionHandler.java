package com.mlregistry.dataset.config;

import com.mlregistry.common.exception.ErrorCode;
import com.mlregistry.common.exception.RegistryException;
import com.mlregistry.common.exception.ResourceConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import javax.validation.ConstraintViolationException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST endpoints.
 * Every error kind maps to a stable status and errorType so callers never match on message text.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistryException(RegistryException ex) {
        HttpStatus status = mapErrorCodeToHttpStatus(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Registry exception: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Registry exception: {} - {}", ex.getErrorCode(), ex.getMessage());
        }

        Map<String, Object> response = errorBody(ex.getErrorCode(), ex.getMessage());
        if (ex instanceof ResourceConflictException) {
            Long existingId = ((ResourceConflictException) ex).getExistingId();
            if (existingId != null) {
                response.put("existingId", existingId);
            }
        }
        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", message);
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.INVALID_REQUEST, message));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof RegistryException) {
                return handleRegistryException((RegistryException) cause);
            }
            cause = cause.getCause();
        }
        log.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.INVALID_REQUEST,
                "Invalid value for parameter '" + ex.getName() + "'"));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadableRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody(ErrorCode.INVALID_REQUEST, "Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(ErrorCode.UNKNOWN_ERROR, "An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(ErrorCode errorCode, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", LocalDateTime.now());
        response.put("errorCode", errorCode.getCode());
        response.put("errorType", errorCode.name());
        response.put("message", message);
        return response;
    }

    static HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        int code = errorCode.getCode();

        if (code >= 1000 && code < 2000) {
            return HttpStatus.BAD_REQUEST;
        } else if (code >= 2000 && code < 3000) {
            return HttpStatus.NOT_FOUND;
        } else if (code >= 3000 && code < 4000) {
            return HttpStatus.CONFLICT;
        } else if (code >= 4000 && code < 5000) {
            return HttpStatus.NOT_FOUND;
        } else if (code >= 5000 && code < 6000) {
            return HttpStatus.BAD_GATEWAY;
        } else {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
