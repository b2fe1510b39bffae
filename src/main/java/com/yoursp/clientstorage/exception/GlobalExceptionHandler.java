package com.yoursp.clientstorage.exception;

import com.yoursp.clientstorage.modules.keys.exception.ClientKeyNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.InvalidStoragePathException;
import com.yoursp.clientstorage.service.storage.exception.StorageException;
import com.yoursp.clientstorage.service.storage.exception.StoredFileNotFoundException;
import com.yoursp.clientstorage.service.storage.exception.UnauthorizedClientException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces and filesystem paths are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Validation Failed", null);
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(InvalidStoragePathException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidPath(InvalidStoragePathException ex) {
        return ResponseEntity.badRequest()
                .body(body(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage()));
    }

    @ExceptionHandler(StoredFileNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleFileNotFound(StoredFileNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(HttpStatus.NOT_FOUND, "NOT_FOUND", "File not found"));
    }

    @ExceptionHandler(ClientKeyNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleClientKeyNotFound(ClientKeyNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(UnauthorizedClientException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedClientException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(body(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", ex.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(body(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", "Uploaded file exceeds the size limit"));
    }

    /**
     * Filesystem faults. The exception message carries physical paths, so it
     * is logged but not returned.
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorageException(StorageException ex) {
        log.error("Storage failure [correlationId={}]: {}", MDC.get(CORRELATION_ID_KEY), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR",
                        "The storage operation failed. Please reference correlationId for support."));
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with the correlation ID and no stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        // Framework exceptions (missing parameter, unknown static resource, ...) carry their own status
        if (ex instanceof ErrorResponse errorResponse && !errorResponse.getStatusCode().is5xxServerError()) {
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            return ResponseEntity.status(status)
                    .body(body(status, status.getReasonPhrase(), errorResponse.getBody().getDetail()));
        }

        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                        "An unexpected error occurred. Please reference correlationId for support."));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        if (message != null) {
            body.put("message", message);
        }
        body.put("correlationId", MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
