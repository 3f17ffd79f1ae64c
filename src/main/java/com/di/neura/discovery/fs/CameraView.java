package com.di.neura.discovery.fs;

/**
 * The two fixed camera views recorded for every episode.
 */
public enum CameraView {

    FRONT("front", "observation.images.front"),
    WRIST("wrist", "observation.images.wrist");

    private final String shortName;
    private final String directoryName;

    CameraView(String shortName, String directoryName) {
        this.shortName = shortName;
        this.directoryName = directoryName;
    }

    public String getShortName() {
        return shortName;
    }

    /** Directory under {@code videos/chunk-<chunk>/}; also the logical name used when combining fingerprints. */
    public String getDirectoryName() {
        return directoryName;
    }
}
