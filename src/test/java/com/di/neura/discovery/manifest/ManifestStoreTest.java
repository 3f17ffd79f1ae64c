package com.di.neura.discovery.manifest;

import com.di.neura.discovery.fs.CameraView;
import com.di.neura.discovery.fs.LocalEpisodeFileSystem;
import com.di.neura.discovery.model.EpisodeKey;
import com.di.neura.discovery.model.Manifest;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.RowDiagnostic;
import com.di.neura.discovery.model.Status;
import com.di.neura.testsupport.EpisodeTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManifestStore Tests")
class ManifestStoreTest {

    private static final String ALGO = "size+mtime+sha256(head|tail)-v1";

    @TempDir
    Path tmp;

    private final ManifestStore store = new ManifestStore();

    // ============================================================================
    // Deletions
    // ============================================================================

    @Test
    @DisplayName("Should emit DELETED rows for previous keys absent from the current scan")
    void testDiffDeletions() {
        List<ManifestRow> previous = List.of(
                row("000", 4, Status.NEW, "fp4"),
                row("000", 5, Status.UNCHANGED, "fp5"),
                row("001", 0, Status.CHANGED, "fp0"));

        List<ManifestRow> deleted = store.diffDeletions(previous,
                Set.of(new EpisodeKey("000", 4), new EpisodeKey("001", 0)), ALGO);

        assertEquals(1, deleted.size());
        ManifestRow d = deleted.get(0);
        assertEquals(new EpisodeKey("000", 5), d.getKey());
        assertEquals(Status.DELETED, d.getStatus());
        assertNull(d.getFingerprint());
        assertNull(d.getParquetUri());
        assertNull(d.getVideoFrontUri());
        assertFalse(d.isExistsFront());
        assertEquals(0L, d.getBytesTotal());
        assertEquals(ALGO, d.getFingerprintAlgo());
        assertNotNull(d.getDiscoveredAt());
    }

    @Test
    @DisplayName("Should not re-report deletions, previous orphans or unparseable rows")
    void testDiffDeletions_Skips() {
        List<ManifestRow> previous = List.of(
                row("000", 1, Status.DELETED, null),
                row("000", 2, Status.ORPHAN_VIDEO, null),
                row("000", EpisodeKey.UNPARSEABLE_INDEX, Status.ERROR, null));

        assertTrue(store.diffDeletions(previous, Set.of(), ALGO).isEmpty());
    }

    @Test
    @DisplayName("Should emit one DELETED row per key even if the previous manifest repeats it")
    void testDiffDeletions_DuplicateKeys() {
        List<ManifestRow> previous = List.of(
                row("000", 3, Status.NEW, "a"),
                row("000", 3, Status.NEW, "a"));

        assertEquals(1, store.diffDeletions(previous, Set.of(), ALGO).size());
    }

    // ============================================================================
    // Orphans
    // ============================================================================

    @Test
    @DisplayName("Should emit one ORPHAN_VIDEO row per video file without a trajectory")
    void testDiffOrphans() {
        EpisodeTree tree = new EpisodeTree(tmp);
        tree.episode("000", 1);
        tree.video("000", CameraView.FRONT, 9, "front only");
        tree.video("000", CameraView.FRONT, 8, "both views");
        tree.video("000", CameraView.WRIST, 8, "both views");
        tree.video("000", CameraView.WRIST, 1, "has trajectory");
        tree.file("videos/chunk-000/observation.images.front/episode_bad.mp4", "skipped");

        List<ManifestRow> orphans = store.diffOrphans(new LocalEpisodeFileSystem(tmp, "parquet"),
                List.of("000"), Set.of(new EpisodeKey("000", 1)), ALGO);

        assertEquals(3, orphans.size());
        ManifestRow nine = orphans.stream().filter(r -> r.getEpisodeIndex() == 9).findFirst().orElseThrow();
        assertEquals(Status.ORPHAN_VIDEO, nine.getStatus());
        assertTrue(nine.isExistsFront());
        assertFalse(nine.isExistsWrist());
        assertNotNull(nine.getVideoFrontUri());
        assertNull(nine.getVideoWristUri());
        assertNull(nine.getFingerprint());
        assertNull(nine.getParquetUri());
        assertEquals(2, orphans.stream().filter(r -> r.getEpisodeIndex() == 8).count());
    }

    @Test
    @DisplayName("Should ignore chunks outside the scanned set")
    void testDiffOrphans_OnlyScannedChunks() {
        EpisodeTree tree = new EpisodeTree(tmp);
        tree.video("001", CameraView.FRONT, 0, "orphan in unscanned chunk");

        assertTrue(store.diffOrphans(new LocalEpisodeFileSystem(tmp, "parquet"),
                List.of("000"), Set.of(), ALGO).isEmpty());
    }

    // ============================================================================
    // Selection
    // ============================================================================

    @Test
    @DisplayName("Should select every row except UNCHANGED, preserving order")
    void testSelectActionable() {
        ManifestRow a = row("000", 0, Status.UNCHANGED, "a");
        ManifestRow b = row("000", 1, Status.PENDING, "b");
        ManifestRow c = row("000", 2, Status.UNCHANGED, "c");
        ManifestRow d = row("000", 3, Status.ORPHAN_VIDEO, null);

        assertEquals(List.of(b, d), store.selectActionable(List.of(a, b, c, d)));
        assertEquals(List.of(b, d), store.selectActionable(Manifest.of("/data", List.of(a, b, c, d))));
    }

    // ============================================================================
    // Load / persist
    // ============================================================================

    @Test
    @DisplayName("Load returns empty when no snapshot exists")
    void testLoad_Missing() {
        assertEquals(Optional.empty(), store.load(tmp.resolve("none.json")));
    }

    @Test
    @DisplayName("Persist creates parent directories and round-trips every field")
    void testPersistAndLoad() throws Exception {
        ManifestRow error = row("000", EpisodeKey.UNPARSEABLE_INDEX, Status.ERROR, null).toBuilder()
                .parquetUri("/data/chunk-000/episode_x.parquet")
                .errors(RowDiagnostic.badEpisodeName("episode_x.parquet"))
                .build();
        ManifestRow ok = row("000", 1, Status.NEW, "fp1").toBuilder()
                .parquetUri("/data/chunk-000/episode_000001.parquet")
                .videoFrontUri("/v/front.mp4").existsFront(true)
                .bytesTotal(123L)
                .build();
        Path path = tmp.resolve("nested/dir/episodes.json");

        store.persist(Manifest.of("/data", List.of(error, ok)), path);
        Manifest loaded = store.load(path).orElseThrow();

        assertEquals(Manifest.FORMAT_VERSION, loaded.getFormatVersion());
        assertEquals("/data", loaded.getDataRoot());
        assertEquals(2, loaded.getRowCount());
        assertEquals(List.of(error, ok), loaded.getRows());

        String json = Files.readString(path);
        assertTrue(json.contains("\"episode_index\""));
        assertTrue(json.contains("\"fingerprint_algo\""));
        assertTrue(json.contains("\"bad_episode_name\""));
        assertFalse(json.contains("\"key\""));
    }

    @Test
    @DisplayName("Load of an unreadable snapshot fails loudly")
    void testLoad_Corrupt() throws Exception {
        Path path = tmp.resolve("episodes.json");
        Files.writeString(path, "{ not json");

        assertThrows(ManifestStoreException.class, () -> store.load(path));
    }

    @Test
    @DisplayName("A failed rename leaves the previous snapshot intact and no temp file behind")
    void testPersist_AtomicOnFailure() throws Exception {
        Path path = tmp.resolve("episodes.json");
        store.persist(Manifest.of("/data", List.of(row("000", 1, Status.NEW, "old"))), path);
        String before = Files.readString(path);

        ManifestWriter failing = new ManifestWriter() {
            @Override
            void moveIntoPlace(Path tmpFile, Path target) throws IOException {
                throw new IOException("simulated crash before rename");
            }
        };
        ManifestStore failingStore = new ManifestStore(new ManifestReader(), failing);

        ManifestStoreException ex = assertThrows(ManifestStoreException.class,
                () -> failingStore.persist(Manifest.of("/data", List.of(row("000", 2, Status.NEW, "new"))), path));
        assertInstanceOf(IOException.class, ex.getCause());

        assertEquals(before, Files.readString(path));
        try (Stream<Path> files = Files.list(tmp)) {
            assertEquals(List.of(path), files.toList());
        }
    }

    private static ManifestRow row(String chunk, int index, Status status, String fingerprint) {
        return ManifestRow.builder()
                .chunk(chunk)
                .episodeIndex(index)
                .fingerprint(fingerprint)
                .fingerprintAlgo(ALGO)
                .discoveredAt(Instant.parse("2024-05-17T12:00:00Z"))
                .status(status)
                .build();
    }
}
