package com.di.neura.discovery;

import com.di.neura.discovery.model.Manifest;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one discovery run.
 */
@Value
@Builder
public class DiscoveryResult {

    String runId;

    /** Rows observed by this run whose status is actionable, in manifest order. */
    List<ManifestRow> actionableRows;

    /** The snapshot that was persisted, including rows carried from unscanned scope. */
    Manifest manifest;

    Path manifestPath;

    /** Row counts per status over the rows observed by this run. */
    Map<Status, Integer> statusCounts;

    /** Sum of {@code bytes_total} over this run's fingerprinted rows. */
    long bytesFingerprinted;

    long durationMs;
}
