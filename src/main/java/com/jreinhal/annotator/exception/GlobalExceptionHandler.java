package com.jreinhal.annotator.exception;

import com.jreinhal.annotator.auth.AuthenticationFailedException;
import com.jreinhal.annotator.navigation.UnknownSessionException;
import com.jreinhal.annotator.store.ExportFailedException;
import com.jreinhal.annotator.store.StoreUnavailableException;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final Pattern PACKAGE_PATTERN = Pattern.compile("\\w+(\\.\\w+){2,}");

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleAuthentication(AuthenticationFailedException ex) {
        // real reason stays server-side
        if (log.isWarnEnabled()) {
            log.warn("Authentication failed: {}", ex.getMessage());
        }
        return error(HttpStatus.UNAUTHORIZED, "Invalid username or password");
    }

    @ExceptionHandler({UnknownSessionException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleUnknownSession(Exception ex) {
        return error(HttpStatus.UNAUTHORIZED, "Annotation session expired or missing; log in again");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(ex.getMessage(), "Invalid request"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, sanitizeExceptionMessage(message, "Invalid request"));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException ex) {
        return error(HttpStatus.CONFLICT, sanitizeExceptionMessage(ex.getMessage(), "Operation not allowed now"));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Record store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Record store unavailable; try again later");
    }

    @ExceptionHandler(ExportFailedException.class)
    public ResponseEntity<Map<String, Object>> handleExportFailed(ExportFailedException ex) {
        log.error("Export failed ({}): {}", ex.getReason(), ex.getMessage());
        if (ex.getReason() == ExportFailedException.Reason.PERMISSION_DENIED) {
            return error(HttpStatus.FORBIDDEN, "Export target is not writable");
        }
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Export failed");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    static String sanitizeExceptionMessage(String message, String fallback) {
        if (message == null || message.isBlank()) {
            return fallback;
        }
        // file paths, class names and stack-trace fragments never reach the client
        if (message.contains("/") || message.contains("\\")
                || message.contains("Exception") || message.contains("at ")
                || PACKAGE_PATTERN.matcher(message).find()
                || message.length() > 200) {
            return fallback;
        }
        return message;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }
}
