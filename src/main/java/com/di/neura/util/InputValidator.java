package com.di.neura.util;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Validation and normalization of discovery run parameters.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Worker Pool Bounds
    // ============================================================================

    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 64;

    // ============================================================================
    // Chunk Identifier Pattern
    // ============================================================================

    /**
     * Chunk ids become directory names ({@code chunk-<id>}): letters, digits,
     * dots, underscores and dashes only, no path separators.
     */
    private static final Pattern VALID_CHUNK_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    private static final String CHUNK_PREFIX = "chunk-";

    // ============================================================================
    // Workers
    // ============================================================================

    /**
     * Clamps the worker count to [{@value #MIN_WORKERS}, {@value #MAX_WORKERS}].
     */
    public static int validateWorkers(int workers) {
        if (workers < MIN_WORKERS) {
            log.warn("Requested {} workers; clamping to {}", workers, MIN_WORKERS);
            return MIN_WORKERS;
        }
        if (workers > MAX_WORKERS) {
            log.warn("Requested {} workers; clamping to {}", workers, MAX_WORKERS);
            return MAX_WORKERS;
        }
        return workers;
    }

    // ============================================================================
    // Chunks
    // ============================================================================

    /**
     * Normalizes a single chunk id: trims it and strips a leading {@code chunk-}.
     *
     * @throws IllegalArgumentException if the id is blank or contains invalid characters
     */
    public static String normalizeChunkId(String chunk) {
        if (chunk == null || chunk.isBlank()) {
            throw new IllegalArgumentException("Chunk id cannot be null or empty");
        }
        String trimmed = chunk.trim();
        if (trimmed.startsWith(CHUNK_PREFIX)) {
            trimmed = trimmed.substring(CHUNK_PREFIX.length());
        }
        if (!VALID_CHUNK_PATTERN.matcher(trimmed).matches() || trimmed.equals(".") || trimmed.equals("..")) {
            throw new IllegalArgumentException(String.format(
                    "Invalid chunk id: '%s'. Only letters, digits, '.', '_' and '-' are allowed.", chunk));
        }
        return trimmed;
    }

    /**
     * Normalizes an optional chunk restriction. Blank entries are dropped.
     *
     * @return sorted set of chunk ids, or {@code null} when no restriction applies
     */
    public static Set<String> normalizeChunks(Collection<String> chunks) {
        if (chunks == null) return null;
        Set<String> out = new TreeSet<>();
        for (String c : chunks) {
            if (c == null || c.isBlank()) continue;
            out.add(normalizeChunkId(c));
        }
        return out.isEmpty() ? null : out;
    }

    /** Splits a comma-separated chunk list ({@code "chunk-000, 003"}). */
    public static Set<String> parseChunkList(String csv) {
        if (csv == null || csv.isBlank()) return null;
        return normalizeChunks(java.util.Arrays.asList(csv.split(",")));
    }

    // ============================================================================
    // Timestamps
    // ============================================================================

    /**
     * Parses an ISO-8601 timestamp. Accepts {@code Z} or an explicit offset;
     * a local date-time without offset is read as UTC.
     *
     * @return the instant, or {@code null} for a blank input
     * @throws IllegalArgumentException if the value is not ISO-8601
     */
    public static Instant parseSince(String since) {
        if (since == null || since.isBlank()) return null;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(since.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "since must be ISO-8601, e.g. 2024-05-17T12:34:56Z, got: " + since, e);
        }
    }

    // ============================================================================
    // Paths
    // ============================================================================

    public static Path validatePath(String path, String name) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException(String.format("%s cannot be null or empty", name));
        }
        try {
            return Path.of(path.trim());
        } catch (java.nio.file.InvalidPathException e) {
            throw new IllegalArgumentException(String.format("Invalid %s: %s", name, path), e);
        }
    }
}
