package com.di.neura.discovery.model;

/**
 * Lifecycle status of one manifest row. Exactly one value per row.
 *
 * <p>Every status except {@link #UNCHANGED} is <em>actionable</em>: downstream
 * stages (validation, statistics, materialization) re-process the episode.
 */
public enum Status {

    NEW("Episode seen for the first time"),
    CHANGED("Episode content differs from the previous run"),
    UNCHANGED("Episode content identical to the previous run"),
    MISSING_SIDE("Trajectory present but at least one camera video is absent"),
    DELETED("Episode known to the previous run but absent from this scan"),
    ORPHAN_VIDEO("Video file without a trajectory file for the same key"),
    PENDING("At least one file is still being written"),
    ERROR("Episode could not be fingerprinted");

    private final String description;

    Status(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActionable() {
        switch (this) {
            case UNCHANGED:
                return false;
            case NEW:
            case CHANGED:
            case MISSING_SIDE:
            case DELETED:
            case ORPHAN_VIDEO:
            case PENDING:
            case ERROR:
                return true;
            default:
                throw new IllegalStateException("Unhandled status: " + this);
        }
    }
}
