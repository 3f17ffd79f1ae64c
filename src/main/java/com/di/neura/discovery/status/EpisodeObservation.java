package com.di.neura.discovery.status;

import lombok.Builder;
import lombok.Value;

/**
 * What a single scan observed about one episode's files, plus the episode's
 * previous fingerprint (if any). Input to {@link StatusResolver#resolve}.
 */
@Value
@Builder
public class EpisodeObservation {

    boolean trajectoryExists;
    boolean trajectoryStable;

    boolean frontExists;
    boolean frontStable;

    boolean wristExists;
    boolean wristStable;

    /** Combined fingerprint; null when {@link #failure} is set. */
    String fingerprint;
    String fingerprintAlgo;

    /** Exception raised while stat'ing or fingerprinting any required file. */
    Throwable failure;

    String previousFingerprint;
    String previousFingerprintAlgo;

    public boolean anyExistingFileUnstable() {
        return (trajectoryExists && !trajectoryStable)
                || (frontExists && !frontStable)
                || (wristExists && !wristStable);
    }

    public boolean anyVideoMissing() {
        return !frontExists || !wristExists;
    }
}
