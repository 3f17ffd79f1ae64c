package com.di.neura.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Comparator;

/**
 * One episode as observed by a discovery run (or carried from the previous one).
 *
 * <p>Serialized with snake_case property names ({@code episode_index},
 * {@code parquet_uri}, ...) by the manifest {@code ObjectMapper}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ManifestRow {

    /**
     * Deterministic manifest order. Ties on the key are broken by status and
     * file URIs so that output never depends on task completion order.
     */
    public static final Comparator<ManifestRow> MANIFEST_ORDER =
            Comparator.comparing(ManifestRow::getChunk)
                    .thenComparingInt(ManifestRow::getEpisodeIndex)
                    .thenComparing(ManifestRow::getStatus)
                    .thenComparing(ManifestRow::getParquetUri, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(ManifestRow::getVideoFrontUri, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(ManifestRow::getVideoWristUri, Comparator.nullsFirst(Comparator.naturalOrder()));

    int episodeIndex;
    String chunk;

    String parquetUri;
    String videoFrontUri;
    String videoWristUri;

    boolean existsFront;
    boolean existsWrist;

    /** Sum of the sizes of the files that were fingerprinted for this row. */
    long bytesTotal;

    String fingerprint;
    String fingerprintAlgo;

    Instant discoveredAt;
    Status status;

    RowDiagnostic errors;

    @JsonIgnore
    public EpisodeKey getKey() {
        return EpisodeKey.of(this);
    }
}
