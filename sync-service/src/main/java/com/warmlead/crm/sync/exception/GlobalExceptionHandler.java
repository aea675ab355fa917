package com.warmlead.crm.sync.exception;

import com.warmlead.crm.common.error.ErrorClassification;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Fatal sync failures carry a user-facing message; the raw cause is only logged.
     */
    @ExceptionHandler(SyncFailedException.class)
    public ResponseEntity<ErrorResponse> handleSyncFailedException(SyncFailedException e) {
        log.warn("Sync {} failed: {}: {}", e.getSyncId(), e.getKind(), e.getMessage());
        ErrorResponse error = new ErrorResponse(
            "SYNC_" + e.getKind().name(),
            e.getUserMessage(),
            LocalDateTime.now()
        );
        return ResponseEntity.status(statusFor(e.getKind())).body(error);
    }

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<ErrorResponse> handleSyncException(SyncException e) {
        log.warn("{} error: {}", e.getKind(), e.getMessage());
        String message = e.getKind() == ErrorKind.RATE_LIMIT
            ? e.getMessage()
            : ErrorClassification.of(e.getKind()).userMessage();
        ErrorResponse error = new ErrorResponse(
            e.getKind().name(),
            message,
            LocalDateTime.now()
        );
        return ResponseEntity.status(statusFor(e.getKind())).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("Illegal argument: {}", e.getMessage());
        ErrorResponse error = new ErrorResponse(
            "BAD_REQUEST",
            e.getMessage(),
            LocalDateTime.now()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(SyncAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleSyncAlreadyRunning(SyncAlreadyRunningException e) {
        log.info("Rejected sync for user {}: {}", e.getUserId(), e.getMessage());
        ErrorResponse error = new ErrorResponse(
            "CONFLICT",
            e.getMessage(),
            LocalDateTime.now()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        ErrorResponse error = new ErrorResponse(
            "UNAUTHORIZED",
            "Missing " + e.getHeaderName() + " header",
            LocalDateTime.now()
        );
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("errorCode", "VALIDATION_ERROR");
        response.put("message", "Validation failed");
        response.put("errors", errors);
        response.put("timestamp", LocalDateTime.now());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Database access error: {}", e.getMessage(), e);
        ErrorResponse error = new ErrorResponse(
            "DATABASE_ERROR",
            ErrorKind.DATABASE.getUserMessage(),
            LocalDateTime.now()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        ErrorResponse error = new ErrorResponse(
            "INTERNAL_SERVER_ERROR",
            ErrorKind.UNKNOWN.getUserMessage(),
            LocalDateTime.now()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.BAD_GATEWAY;
        };
    }

    /**
     * Error body returned by every endpoint.
     */
    public static class ErrorResponse {
        private boolean success = false;
        private String errorCode;
        private String message;
        private LocalDateTime timestamp;

        public ErrorResponse(String errorCode, String message, LocalDateTime timestamp) {
            this.errorCode = errorCode;
            this.message = message;
            this.timestamp = timestamp;
        }

        public boolean isSuccess() { return success; }
        public String getErrorCode() { return errorCode; }
        public String getMessage() { return message; }
        public LocalDateTime getTimestamp() { return timestamp; }
    }
}
