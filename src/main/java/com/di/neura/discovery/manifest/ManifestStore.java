package com.di.neura.discovery.manifest;

import com.di.neura.discovery.fs.CameraView;
import com.di.neura.discovery.fs.EpisodeFileNames;
import com.di.neura.discovery.fs.EpisodeFileSystem;
import com.di.neura.discovery.model.EpisodeKey;
import com.di.neura.discovery.model.Manifest;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Previous-snapshot access, set differences against the current scan, and
 * atomic persistence of the new snapshot.
 *
 * <p>Holds no run state: the previous manifest is always passed in explicitly,
 * so scans over different data roots never interfere.
 */
@Slf4j
public class ManifestStore {

    private final ManifestReader reader;
    private final ManifestWriter writer;

    public ManifestStore() {
        this(new ManifestReader(), new ManifestWriter());
    }

    public ManifestStore(ManifestReader reader, ManifestWriter writer) {
        this.reader = reader;
        this.writer = writer;
    }

    /** Empty on the first run, when no snapshot exists yet. */
    public Optional<Manifest> load(Path path) {
        return reader.read(path);
    }

    public void persist(Manifest manifest, Path path) {
        writer.write(manifest, path);
    }

    /* ------------------------------------------------------------------ */
    /* Deletions                                                            */
    /* ------------------------------------------------------------------ */

    /**
     * One {@link Status#DELETED} row per previous key absent from {@code currentKeys}.
     *
     * <p>Previous rows that were already {@code DELETED} are not reported again
     * (the caller carries them into the snapshot as they are), and previous {@code ORPHAN_VIDEO} rows are skipped because orphans are
     * recomputed from disk on every run. Rows with an unparseable index have no
     * stable identity and are never carried forward.
     */
    public List<ManifestRow> diffDeletions(Collection<ManifestRow> previousRows,
                                           Set<EpisodeKey> currentKeys,
                                           String fingerprintAlgo) {
        Set<EpisodeKey> deletedKeys = new LinkedHashSet<>();
        for (ManifestRow prev : previousRows) {
            if (prev.getStatus() == Status.DELETED || prev.getStatus() == Status.ORPHAN_VIDEO) continue;
            EpisodeKey key = prev.getKey();
            if (key.isParsed() && !currentKeys.contains(key)) {
                deletedKeys.add(key);
            }
        }

        Instant now = Instant.now();
        List<ManifestRow> deleted = new ArrayList<>(deletedKeys.size());
        for (EpisodeKey key : deletedKeys) {
            deleted.add(ManifestRow.builder()
                    .chunk(key.chunk())
                    .episodeIndex(key.episodeIndex())
                    .existsFront(false)
                    .existsWrist(false)
                    .bytesTotal(0L)
                    .fingerprint(null)
                    .fingerprintAlgo(fingerprintAlgo)
                    .discoveredAt(now)
                    .status(Status.DELETED)
                    .build());
        }
        if (!deleted.isEmpty()) {
            log.info("[MANIFEST-DIFF] {} episode(s) deleted since previous run", deleted.size());
        }
        return deleted;
    }

    /* ------------------------------------------------------------------ */
    /* Orphans                                                              */
    /* ------------------------------------------------------------------ */

    /**
     * One {@link Status#ORPHAN_VIDEO} row per video file whose key has no
     * trajectory file. Each row references only the camera view it was found
     * in; video names without a parseable index are skipped.
     */
    public List<ManifestRow> diffOrphans(EpisodeFileSystem fs,
                                         Collection<String> chunks,
                                         Set<EpisodeKey> trajectoryKeys,
                                         String fingerprintAlgo) {
        Instant now = Instant.now();
        List<ManifestRow> orphans = new ArrayList<>();
        for (String chunk : chunks) {
            for (CameraView view : CameraView.values()) {
                for (Path video : fs.listVideoFiles(chunk, view)) {
                    OptionalInt idx = EpisodeFileNames.parseEpisodeIndex(video);
                    if (idx.isEmpty()) {
                        log.debug("[MANIFEST-DIFF] skipping unparseable video name {}", video);
                        continue;
                    }
                    if (trajectoryKeys.contains(new EpisodeKey(chunk, idx.getAsInt()))) continue;

                    boolean front = view == CameraView.FRONT;
                    orphans.add(ManifestRow.builder()
                            .chunk(chunk)
                            .episodeIndex(idx.getAsInt())
                            .videoFrontUri(front ? video.toString() : null)
                            .videoWristUri(front ? null : video.toString())
                            .existsFront(front)
                            .existsWrist(!front)
                            .bytesTotal(0L)
                            .fingerprint(null)
                            .fingerprintAlgo(fingerprintAlgo)
                            .discoveredAt(now)
                            .status(Status.ORPHAN_VIDEO)
                            .build());
                }
            }
        }
        if (!orphans.isEmpty()) {
            log.info("[MANIFEST-DIFF] {} orphan video(s) without a trajectory file", orphans.size());
        }
        return orphans;
    }

    /* ------------------------------------------------------------------ */
    /* Selection                                                            */
    /* ------------------------------------------------------------------ */

    /** Rows downstream stages must (re)process: everything except {@link Status#UNCHANGED}. Order preserved. */
    public List<ManifestRow> selectActionable(Collection<ManifestRow> rows) {
        List<ManifestRow> out = new ArrayList<>();
        for (ManifestRow row : rows) {
            if (row.getStatus().isActionable()) {
                out.add(row);
            }
        }
        return out;
    }

    public List<ManifestRow> selectActionable(Manifest manifest) {
        return selectActionable(manifest.getRows());
    }
}
