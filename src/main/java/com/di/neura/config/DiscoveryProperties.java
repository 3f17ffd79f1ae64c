package com.di.neura.config;

import com.di.neura.discovery.DiscoveryRequest;
import com.di.neura.discovery.fingerprint.Fingerprinter;
import com.di.neura.discovery.fingerprint.StabilityChecker;
import com.di.neura.util.InputValidator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Single binding for all discovery configuration.
 *
 * <pre>
 * neura:
 *   discovery:
 *     data-root: ./robot_data
 *     manifest-path: ./output/manifest/episodes.json
 *     workers: 16
 *     full-hash: false
 *     sample-bytes: 65536
 *     stability-min-bytes: 52428800
 *     stability-pause-ms: 150
 *     trajectory-extension: parquet
 *     run-on-startup: false
 *     emit-jsonl: false
 *     print-all: false
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "neura.discovery")
public class DiscoveryProperties {

    // ------------------------------------------------------------------ //
    // Locations                                                          //
    // ------------------------------------------------------------------ //

    /** Root folder containing {@code data/} and {@code videos/}. */
    private String dataRoot = "./robot_data";

    /** Manifest snapshot, read at the start of a run and atomically replaced at the end. */
    private String manifestPath = "./output/manifest/episodes.json";

    /** File extension of trajectory files under {@code data/chunk-*}. */
    private String trajectoryExtension = "parquet";

    // ------------------------------------------------------------------ //
    // Fingerprinting                                                     //
    // ------------------------------------------------------------------ //

    /** Default fingerprinting pool size; clamped to [1, 64] per run. */
    private int workers = 16;

    /** Hash whole files instead of head/tail samples. */
    private boolean fullHash = false;

    /** Bytes read from the head (and tail) of a file in sampled mode. */
    private int sampleBytes = Fingerprinter.DEFAULT_SAMPLE_BYTES;

    /** Files at least this large get the two-sample stability check. */
    private long stabilityMinBytes = StabilityChecker.DEFAULT_MIN_BYTES;

    /** Pause between the two stability samples. */
    private long stabilityPauseMs = StabilityChecker.DEFAULT_PAUSE.toMillis();

    // ------------------------------------------------------------------ //
    // Startup run                                                        //
    // ------------------------------------------------------------------ //

    /** Run one discovery with the settings above when the application starts. */
    private boolean runOnStartup = false;

    /** Startup run: write actionable rows to stdout as JSON Lines. */
    private boolean emitJsonl = false;

    /** Startup run: log the full manifest instead of only the actionable rows. */
    private boolean printAll = false;

    /**
     * Default ISO-8601 lower bound on trajectory modification time.
     * Blank = no filter.
     */
    private String since;

    /** Default comma-separated chunk restriction ({@code 000,chunk-003}). */
    private String onlyChunks;

    /**
     * A run request populated from these settings. Callers override individual
     * fields (REST body, tests) before {@code build()}.
     *
     * @throws IllegalArgumentException when a configured value is invalid
     */
    public DiscoveryRequest.DiscoveryRequestBuilder toRequestBuilder() {
        return DiscoveryRequest.builder()
                .dataRoot(InputValidator.validatePath(dataRoot, "data-root"))
                .manifestPath(InputValidator.validatePath(manifestPath, "manifest-path"))
                .workers(workers)
                .fullHash(fullHash)
                .since(InputValidator.parseSince(since))
                .onlyChunks(InputValidator.parseChunkList(onlyChunks))
                .trajectoryExtension(trajectoryExtension);
    }
}
