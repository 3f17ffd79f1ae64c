package com.di.neura.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-serialisable snapshot of every known episode, written at the end of a
 * discovery run and read back at the start of the next one.
 *
 * <p>The snapshot is replaced wholesale on each run; there is no row-level
 * history beyond the single previous fingerprint it carries.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Manifest {

    public static final int FORMAT_VERSION = 1;

    @Builder.Default
    private int           formatVersion = FORMAT_VERSION;
    private Instant       generatedAt;
    private String        dataRoot;
    private int           rowCount;

    @Builder.Default
    private List<ManifestRow> rows = new ArrayList<>();

    public static Manifest of(String dataRoot, List<ManifestRow> rows) {
        return Manifest.builder()
                .generatedAt(Instant.now())
                .dataRoot(dataRoot)
                .rowCount(rows.size())
                .rows(List.copyOf(rows))
                .build();
    }

    /**
     * First row per key, skipping rows with an unparseable index.
     * Used to look up the previous fingerprint of an episode.
     */
    @JsonIgnore
    public Map<EpisodeKey, ManifestRow> indexByKey() {
        Map<EpisodeKey, ManifestRow> byKey = new LinkedHashMap<>();
        if (rows == null) return byKey;
        for (ManifestRow row : rows) {
            EpisodeKey key = row.getKey();
            if (key.isParsed()) {
                byKey.putIfAbsent(key, row);
            }
        }
        return byKey;
    }
}
