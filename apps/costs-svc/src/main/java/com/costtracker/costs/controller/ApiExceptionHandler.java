package com.costtracker.costs.controller;

import com.costtracker.costs.controller.dto.ErrorResponseDto;
import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.exception.UserNotFoundException;
import com.costtracker.costs.web.RequestContextHolder;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final int UNKNOWN_ERROR_ID = 999;

    // body fields whose type errors carry the id of the matching business rule
    private static final Map<String, Integer> TYPED_FIELD_ERROR_IDS = Map.of(
            "sum", 5,
            "userid", 4,
            "id", 2);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidInput(InvalidInputException ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getErrorId(), "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleUserNotFound(UserNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, UserNotFoundException.ERROR_ID, "NOT_FOUND", ex.getMessage(),
                Map.of("userId", ex.getUserId()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorResponseDto> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("Storage unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, null, "STORAGE_UNAVAILABLE", "Storage temporarily unavailable",
                Map.of("reason", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        if (ex.getCause() instanceof MismatchedInputException mismatch && !mismatch.getPath().isEmpty()) {
            String field = mismatch.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(name -> name != null)
                    .collect(Collectors.joining("."));
            Integer id = TYPED_FIELD_ERROR_IDS.get(field);
            return build(HttpStatus.BAD_REQUEST, id, id != null ? "INVALID_ARGUMENT" : "MALFORMED_REQUEST",
                    field + " has the wrong type", Map.of("field", field));
        }
        return build(HttpStatus.BAD_REQUEST, null, "MALFORMED_REQUEST", "Request body is not valid JSON", Map.of());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        Map<String, Object> details = new HashMap<>();
        if (ex instanceof MethodArgumentNotValidException invalid) {
            invalid.getBindingResult().getFieldErrors()
                    .forEach(error -> details.put(error.getField(), error.getDefaultMessage()));
        }
        return build(HttpStatus.BAD_REQUEST, null, "VALIDATION_ERROR", "Request validation failed", details);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        // framework errors (unknown route, wrong method) keep their own status
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            return build(status, null, status.name(), ex.getMessage(), Map.of());
        }
        log.error("Unhandled error", ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, UNKNOWN_ERROR_ID, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, Integer id, String code, String message, Map<String, Object> details) {
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(id, code, message, details, RequestContextHolder.currentTraceId()));
    }
}
