package com.di.neura.exception;

import com.di.neura.discovery.manifest.ManifestStoreException;
import com.fasterxml.jackson.core.JsonParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.format.DateTimeParseException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // Basic Enum Tests
    // ============================================================================

    @Test
    @DisplayName("Should return a name and description for every category")
    void testGetNameAndDescription() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty());
            assertFalse(category.getDescription().isEmpty());
            assertEquals(category.name(), category.toString());
        }
    }

    @Test
    @DisplayName("Should categorize null as UNKNOWN")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    // ============================================================================
    // Categorization Tests
    // ============================================================================

    static Stream<Arguments> categorizedExceptions() {
        return Stream.of(
                Arguments.of(new ManifestStoreException("bad manifest", new IOException("x")), ErrorCategory.MANIFEST_ERROR),
                Arguments.of(new NoSuchFileException("/data/a.parquet"), ErrorCategory.FILE_NOT_FOUND),
                Arguments.of(new FileNotFoundException("/data/a.parquet"), ErrorCategory.FILE_NOT_FOUND),
                Arguments.of(new AccessDeniedException("/data/a.parquet"), ErrorCategory.PERMISSION_ERROR),
                Arguments.of(new IOException("Permission denied"), ErrorCategory.PERMISSION_ERROR),
                Arguments.of(new JsonParseException(null, "unexpected token"), ErrorCategory.SERIALIZATION_ERROR),
                Arguments.of(new TimeoutException("slow"), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new IOException("No space left on device"), ErrorCategory.RESOURCE_ERROR),
                Arguments.of(new IOException("read failed"), ErrorCategory.IO_ERROR),
                Arguments.of(new UncheckedIOException(new IOException("list failed")), ErrorCategory.IO_ERROR),
                Arguments.of(new InterruptedException(), ErrorCategory.CONCURRENCY_ERROR),
                Arguments.of(new ExecutionException(new RuntimeException("task")), ErrorCategory.CONCURRENCY_ERROR),
                Arguments.of(new IllegalArgumentException("bad chunk"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new DateTimeParseException("bad", "x", 0), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new RuntimeException("something else"), ErrorCategory.APPLICATION_ERROR));
    }

    @ParameterizedTest
    @MethodSource("categorizedExceptions")
    @DisplayName("Should categorize exceptions by type and message")
    void testCategorize(Throwable exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
    }
}
