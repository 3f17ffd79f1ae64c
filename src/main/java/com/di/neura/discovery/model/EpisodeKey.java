package com.di.neura.discovery.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Manifest key: an episode index within a chunk.
 * Ordered by chunk (lexicographic) then by index (numeric).
 */
public record EpisodeKey(String chunk, int episodeIndex) implements Comparable<EpisodeKey> {

    /** Episode index used for trajectory files whose name carries no parseable index. */
    public static final int UNPARSEABLE_INDEX = -1;

    private static final Comparator<EpisodeKey> ORDER =
            Comparator.comparing(EpisodeKey::chunk).thenComparingInt(EpisodeKey::episodeIndex);

    public EpisodeKey {
        Objects.requireNonNull(chunk, "chunk");
    }

    public static EpisodeKey of(ManifestRow row) {
        return new EpisodeKey(row.getChunk(), row.getEpisodeIndex());
    }

    public boolean isParsed() {
        return episodeIndex != UNPARSEABLE_INDEX;
    }

    @Override
    public int compareTo(EpisodeKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return chunk + "/" + String.format("%06d", episodeIndex);
    }
}
