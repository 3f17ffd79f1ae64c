package com.di.neura.discovery;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

/**
 * Parameters of one discovery run.
 */
@Value
@Builder
public class DiscoveryRequest {

    public static final int    DEFAULT_WORKERS              = 16;
    public static final String DEFAULT_TRAJECTORY_EXTENSION = "parquet";

    Path dataRoot;
    Path manifestPath;

    @Builder.Default
    int workers = DEFAULT_WORKERS;

    /** Inclusive lower bound on trajectory modification time; null = no filter. */
    Instant since;

    boolean fullHash;

    /** Chunk ids to scan ({@code 000} or {@code chunk-000}); null or empty = all chunks. */
    Set<String> onlyChunks;

    @Builder.Default
    String trajectoryExtension = DEFAULT_TRAJECTORY_EXTENSION;
}
