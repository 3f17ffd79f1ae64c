package com.di.neura.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for InputValidator utility class.
 */
@DisplayName("InputValidator Tests")
class InputValidatorTest {

    // ============================================================================
    // Workers
    // ============================================================================

    @ParameterizedTest
    @ValueSource(ints = {1, 16, 64})
    @DisplayName("Should accept worker counts within bounds")
    void testValidateWorkers_Valid(int workers) {
        assertEquals(workers, InputValidator.validateWorkers(workers));
    }

    @Test
    @DisplayName("Should clamp worker counts above the maximum")
    void testValidateWorkers_Clamped() {
        assertEquals(InputValidator.MAX_WORKERS, InputValidator.validateWorkers(500));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    @DisplayName("Should clamp non-positive worker counts to one")
    void testValidateWorkers_ClampedLow(int workers) {
        assertEquals(InputValidator.MIN_WORKERS, InputValidator.validateWorkers(workers));
    }

    // ============================================================================
    // Chunks
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "000, 000",
            "chunk-000, 000",
            "'  chunk-003 ', 003",
            "chunk-a_b.1, a_b.1"
    })
    @DisplayName("Should normalize chunk ids")
    void testNormalizeChunkId_Valid(String input, String expected) {
        assertEquals(expected, InputValidator.normalizeChunkId(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"../etc", "chunk-..", "a/b", "a b", "..", "chunk-"})
    @DisplayName("Should reject chunk ids that are not plain directory names")
    void testNormalizeChunkId_Invalid(String input) {
        assertThrows(IllegalArgumentException.class, () -> InputValidator.normalizeChunkId(input));
    }

    @Test
    @DisplayName("Should reject blank chunk ids")
    void testNormalizeChunkId_Blank() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.normalizeChunkId("  "));
        assertTrue(ex.getMessage().contains("cannot be null or empty"));
    }

    @Test
    @DisplayName("Should normalize, deduplicate and sort chunk lists")
    void testNormalizeChunks() {
        assertEquals(List.of("000", "003"),
                List.copyOf(InputValidator.normalizeChunks(Arrays.asList("chunk-003", "000", "chunk-000", " ", null))));
        assertNull(InputValidator.normalizeChunks(null));
        assertNull(InputValidator.normalizeChunks(List.of(" ")));
    }

    @Test
    @DisplayName("Should parse comma-separated chunk lists")
    void testParseChunkList() {
        assertEquals(Set.of("000", "003"), InputValidator.parseChunkList("chunk-000,003"));
        assertNull(InputValidator.parseChunkList(""));
        assertNull(InputValidator.parseChunkList(null));
    }

    // ============================================================================
    // Since
    // ============================================================================

    @Test
    @DisplayName("Should parse ISO-8601 timestamps with Z, offsets, or no zone as UTC")
    void testParseSince_Valid() {
        Instant expected = Instant.parse("2024-05-17T12:34:56Z");
        assertEquals(expected, InputValidator.parseSince("2024-05-17T12:34:56Z"));
        assertEquals(expected, InputValidator.parseSince("2024-05-17T14:34:56+02:00"));
        assertEquals(expected, InputValidator.parseSince("2024-05-17T12:34:56"));
        assertEquals(expected, InputValidator.parseSince(" 2024-05-17T12:34:56Z "));
    }

    @Test
    @DisplayName("Should treat blank since as no filter")
    void testParseSince_Blank() {
        assertNull(InputValidator.parseSince(null));
        assertNull(InputValidator.parseSince(""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yesterday", "2024-05-17", "17/05/2024 12:00"})
    @DisplayName("Should reject non ISO-8601 timestamps")
    void testParseSince_Invalid(String since) {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.parseSince(since));
        assertTrue(ex.getMessage().contains("ISO-8601"));
    }

    // ============================================================================
    // Paths
    // ============================================================================

    @Test
    @DisplayName("Should validate paths")
    void testValidatePath() {
        assertEquals(Path.of("/data/robot"), InputValidator.validatePath(" /data/robot ", "dataRoot"));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> InputValidator.validatePath("", "dataRoot"));
        assertTrue(ex.getMessage().contains("dataRoot"));
    }
}
