package com.di.neura.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for row diagnostics and REST error responses.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    FILE_NOT_FOUND("File not found", "A file or directory disappeared or was never written"),
    PERMISSION_ERROR("Permission denied", "Insufficient permissions to read or write a path"),
    IO_ERROR("I/O error", "File system read or write failure"),
    MANIFEST_ERROR("Manifest error", "The manifest snapshot could not be read or written"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    CONCURRENCY_ERROR("Concurrency error", "A worker task was interrupted or failed unexpectedly"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. Add new categories before APPLICATION_ERROR. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isManifestError, MANIFEST_ERROR);
        MATCHERS.put(ErrorCategory::isFileNotFound, FILE_NOT_FOUND);
        MATCHERS.put(ErrorCategory::isPermissionError, PERMISSION_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isIoError, IO_ERROR);
        MATCHERS.put(ErrorCategory::isConcurrencyError, CONCURRENCY_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers (add new ones here when adding categories) ---

    private static boolean isManifestError(Throwable t) {
        return t instanceof com.di.neura.discovery.manifest.ManifestStoreException;
    }

    private static boolean isFileNotFound(Throwable t) {
        return t instanceof java.nio.file.NoSuchFileException
                || t instanceof java.io.FileNotFoundException;
    }

    private static boolean isPermissionError(Throwable t) {
        return t instanceof java.nio.file.AccessDeniedException
                || t instanceof SecurityException
                || messageContains(t, "permission denied", "access denied");
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException
                || t instanceof java.io.NotSerializableException
                || t instanceof java.io.StreamCorruptedException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || (t.getMessage() != null && t.getMessage().toLowerCase().contains("timeout"));
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || (t instanceof java.io.IOException && messageContains(t, "no space", "too many open files"));
    }

    private static boolean isIoError(Throwable t) {
        return t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean isConcurrencyError(Throwable t) {
        return t instanceof InterruptedException
                || t instanceof java.util.concurrent.ExecutionException
                || t instanceof java.util.concurrent.RejectedExecutionException
                || t instanceof java.util.concurrent.CancellationException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.time.format.DateTimeParseException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
