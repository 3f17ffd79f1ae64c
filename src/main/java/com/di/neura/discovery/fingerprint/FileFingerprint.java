package com.di.neura.discovery.fingerprint;

/**
 * Compact identity of a single file: size, modification time (nanoseconds
 * since the epoch) and a SHA-256 digest over sampled or full content.
 */
public record FileFingerprint(long size, long mtimeNanos, String sha) {
}
