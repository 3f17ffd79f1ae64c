package com.di.neura.exception;

import com.di.neura.discovery.DiscoveryException;
import com.di.neura.discovery.manifest.ManifestStoreException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns exceptions escaping the REST controllers into a structured {@link ErrorResponse},
 * categorized with {@link ErrorCategory}.
 *
 * <p>To handle a specific exception type:
 * <pre>{@code
 * @ExceptionHandler(YourException.class)
 * public ResponseEntity<ErrorResponse> handleYourException(YourException e) {
 *     return respond("YOUR_EXCEPTION", e, HttpStatus.BAD_REQUEST);
 * }
 * }</pre>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Bad run parameters (chunk ids, since, workers, paths).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(IllegalArgumentException e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    /**
     * Bean Validation failures on request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        log.warn("[API] invalid request body: {}", e.getBindingResult().getFieldErrors());
        ErrorResponse body = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        body.setMessage("Request validation failed");
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            body.addDetail(fe.getField(), fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        ErrorResponse body = buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.BAD_REQUEST);
        body.setMessage(String.format("Invalid value '%s' for parameter '%s'", e.getValue(), e.getName()));
        log.warn("[API] {}", body.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Unreadable previous snapshot or failed snapshot write. The previous snapshot is intact.
     */
    @ExceptionHandler(ManifestStoreException.class)
    public ResponseEntity<ErrorResponse> handleManifestException(ManifestStoreException e) {
        return respond("MANIFEST_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(DiscoveryException.class)
    public ResponseEntity<ErrorResponse> handleDiscoveryException(DiscoveryException e) {
        return respond("DISCOVERY_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Handles all other unhandled exceptions (catch-all).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError(eventType, category, e, status);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, HttpStatus status) {
        Throwable rootCause = getRootCause(exception);
        if (status.is4xxClientError()) {
            log.warn("[API] {} [{}]: {}", eventType, category.getName(), exception.getMessage());
        } else {
            log.error("[API] {} [{}] rootCause={}: {}", eventType, category.getName(),
                      rootCause.getClass().getSimpleName(), exception.getMessage(), exception);
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());

        response.addDetail("exceptionType", exception.getClass().getName());
        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        String runId = MDC.get("discoveryRunId");
        if (runId != null) {
            response.addDetail("discoveryRunId", runId);
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new HashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
