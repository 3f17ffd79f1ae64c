package com.di.neura.discovery.fingerprint;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Heuristic check for files still being written by the upstream recorder.
 *
 * <p>Files smaller than {@code minBytes} are assumed to be written atomically.
 * Larger files are sampled twice (size + mtime), {@code pause} apart; the file
 * is stable only if both samples match exactly. A file that vanishes between
 * samples is reported as not stable.
 *
 * <p>The pause blocks the calling thread. It is meant to run inside a
 * fingerprinting worker, never on the control thread. This reduces but does
 * not eliminate races with a concurrent writer.
 */
@Slf4j
public class StabilityChecker {

    public static final long     DEFAULT_MIN_BYTES = 50L * 1024 * 1024;
    public static final Duration DEFAULT_PAUSE     = Duration.ofMillis(150);

    /** Blocks between the two samples. */
    @FunctionalInterface
    interface Pause {
        void await(Duration pause) throws InterruptedException;
    }

    private final long     minBytes;
    private final Duration pause;
    private final Pause    pauser;

    public StabilityChecker() {
        this(DEFAULT_MIN_BYTES, DEFAULT_PAUSE);
    }

    public StabilityChecker(long minBytes, Duration pause) {
        this(minBytes, pause, p -> TimeUnit.MILLISECONDS.sleep(p.toMillis()));
    }

    StabilityChecker(long minBytes, Duration pause, Pause pauser) {
        this.minBytes = minBytes;
        this.pause    = pause;
        this.pauser   = pauser;
    }

    /**
     * @throws IOException when the file attributes cannot be read for a reason
     *                     other than the file being absent
     */
    public boolean isStable(Path file) throws IOException {
        Sample first = sample(file);
        if (first == null) return false;
        if (first.size < minBytes) return true;

        try {
            pauser.await(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        Sample second = sample(file);
        if (second == null) return false;
        boolean stable = first.equals(second);
        if (!stable) {
            log.debug("[STABILITY] {} still growing: {} -> {}", file, first, second);
        }
        return stable;
    }

    private static Sample sample(Path file) throws IOException {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return new Sample(attrs.size(), attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private record Sample(long size, long mtimeNanos) {}
}
