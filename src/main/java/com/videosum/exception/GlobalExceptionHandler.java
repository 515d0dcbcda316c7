package com.videosum.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps queue and upload failures to the JSON error body the UI shows:
 * {@code {timestamp, status, error, message, path}}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(IllegalArgumentException ex,
                                                                HttpServletRequest request) {
        log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return errorBody(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidJobStateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidJobState(InvalidJobStateException ex,
                                                                     HttpServletRequest request) {
        log.warn("Job action not allowed on {}: {}", request.getRequestURI(), ex.getMessage());
        return errorBody(HttpStatus.BAD_REQUEST, "Invalid Job State", ex.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex,
                                                              HttpServletRequest request) {
        log.info(ex.getMessage());
        return errorBody(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex,
                                                                    HttpServletRequest request) {
        log.warn("Upload rejected, size limit is {} bytes", ex.getMaxUploadSize());
        return errorBody(HttpStatus.PAYLOAD_TOO_LARGE, "Upload Too Large",
                "The uploaded video exceeds the maximum allowed size", request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex,
                                                                  HttpServletRequest request) {
        log.warn("Access denied to {}", request.getRequestURI());
        return errorBody(HttpStatus.FORBIDDEN, "Access Denied", "Missing or invalid API key", request);
    }

    @ExceptionHandler(QueueStoreException.class)
    public ResponseEntity<Map<String, Object>> handleQueueStore(QueueStoreException ex,
                                                                HttpServletRequest request) {
        log.error("Queue document could not be written: {}", ex.getMessage(), ex);
        return errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Queue Storage Error", ex.getMessage(), request);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, Object>> handleFileSystem(UncheckedIOException ex,
                                                                HttpServletRequest request) {
        log.error("File system error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "File System Error", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred, check the queue service log", request);
    }

    private ResponseEntity<Map<String, Object>> errorBody(HttpStatus status, String error, String message,
                                                          HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
