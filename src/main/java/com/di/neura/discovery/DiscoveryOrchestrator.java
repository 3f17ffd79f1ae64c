package com.di.neura.discovery;

import com.di.neura.discovery.fingerprint.Fingerprinter;
import com.di.neura.discovery.fingerprint.StabilityChecker;
import com.di.neura.discovery.fs.EpisodeFileNames;
import com.di.neura.discovery.fs.EpisodeFileSystem;
import com.di.neura.discovery.fs.LocalEpisodeFileSystem;
import com.di.neura.discovery.manifest.ManifestStore;
import com.di.neura.discovery.model.EpisodeKey;
import com.di.neura.discovery.model.Manifest;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.Status;
import com.di.neura.discovery.status.StatusResolver;
import com.di.neura.util.DiscoveryMetrics;
import com.di.neura.util.InputValidator;
import com.di.neura.util.MdcPropagation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one incremental discovery pass over a data tree.
 *
 * <h3>Run flow</h3>
 * <pre>
 *   validate ─► load previous ─► enumerate ─► fingerprint (pool) ─► reconcile
 *            ─► deletions + orphans ─► sort ─► persist ─► actionable rows
 * </pre>
 *
 * <h3>Concurrency</h3>
 * Fingerprinting is the only parallel region: one task per trajectory file on a
 * fixed pool of {@code workers} daemon threads ({@code discovery-fp-N}). Tasks
 * share nothing and return owned rows; everything after collection runs on the
 * calling thread. Completion order does not matter because the final snapshot
 * is sorted.
 *
 * <h3>Partial scans</h3>
 * With {@code onlyChunks} or {@code since}, previous rows outside the scanned
 * scope are carried into the new snapshot unchanged. They are persisted but
 * are not part of the run's actionable rows.
 *
 * <h3>Deletions</h3>
 * A {@code DELETED} row is actionable in the run that detects it. While the
 * trajectory stays absent the row is carried in every later snapshot, so
 * readers of the manifest keep the full history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryOrchestrator {

    public static final String MDC_RUN_ID = "discoveryRunId";

    private final Fingerprinter    fingerprinter;
    private final StabilityChecker stabilityChecker;
    private final StatusResolver   statusResolver;
    private final ManifestStore    manifestStore;
    private final DiscoveryMetrics metrics;

    /**
     * @throws IllegalArgumentException on invalid parameters
     * @throws DiscoveryException       when a worker task fails unexpectedly
     * @throws com.di.neura.discovery.manifest.ManifestStoreException
     *                                  when the previous snapshot is unreadable or the new one cannot be written
     */
    public DiscoveryResult run(DiscoveryRequest request) {
        String runId = "disc-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        long start = System.currentTimeMillis();
        try {
            return execute(runId, request, start);
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordRunFailure(elapsed);
            log.error("[DISCOVERY] run {} failed after {}ms: {}", runId, elapsed, e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private DiscoveryResult execute(String runId, DiscoveryRequest request, long start) {
        // 1. validate
        Path dataRoot     = requirePath(request.getDataRoot(), "dataRoot");
        Path manifestPath = requirePath(request.getManifestPath(), "manifestPath");
        int workers       = InputValidator.validateWorkers(request.getWorkers());
        Set<String> onlyChunks = InputValidator.normalizeChunks(request.getOnlyChunks());
        Instant since     = request.getSince();
        String algo       = Fingerprinter.algorithmTag(request.isFullHash());

        EpisodeFileSystem fs = new LocalEpisodeFileSystem(dataRoot, request.getTrajectoryExtension());
        log.info("[DISCOVERY] run {} root={} manifest={} workers={} fullHash={} since={} onlyChunks={}",
                 runId, fs.root(), manifestPath, workers, request.isFullHash(), since, onlyChunks);

        // 2. previous snapshot
        Optional<Manifest> previous = manifestStore.load(manifestPath);
        List<ManifestRow> previousRows = previous.map(Manifest::getRows).orElse(List.of());
        Map<EpisodeKey, ManifestRow> previousByKey = previous.map(Manifest::indexByKey).orElse(Map.of());

        // 3. chunks
        List<String> chunks = onlyChunks != null ? new ArrayList<>(onlyChunks) : fs.listChunks();

        // 4. enumerate
        List<TrajectoryFile> files = new ArrayList<>();
        Set<EpisodeKey> skippedKeys = new HashSet<>();
        for (String chunk : chunks) {
            for (Path trajectory : fs.listTrajectoryFiles(chunk)) {
                if (since != null && modifiedBefore(trajectory, since)) {
                    OptionalInt idx = EpisodeFileNames.parseEpisodeIndex(trajectory);
                    if (idx.isPresent()) skippedKeys.add(new EpisodeKey(chunk, idx.getAsInt()));
                    continue;
                }
                if (since != null && !Files.exists(trajectory)) continue;
                files.add(new TrajectoryFile(chunk, trajectory));
            }
        }
        log.info("[DISCOVERY] {} chunk(s), {} trajectory file(s) to fingerprint, {} skipped by since",
                 chunks.size(), files.size(), skippedKeys.size());

        // 5. fingerprint
        EpisodeScanner scanner = new EpisodeScanner(fs, fingerprinter, stabilityChecker, statusResolver, request.isFullHash());
        List<ManifestRow> scanned = fingerprintAll(scanner, files, workers);

        // 6. reconcile
        List<ManifestRow> current = new ArrayList<>(scanned.size());
        Set<EpisodeKey> currentKeys = new HashSet<>();
        for (ManifestRow row : scanned) {
            EpisodeKey key = row.getKey();
            if (key.isParsed()) {
                current.add(statusResolver.reconcile(row, previousByKey.get(key)));
                currentKeys.add(key);
            } else {
                current.add(row);
            }
        }

        // 7. deletions, orphans, carried scope
        Set<String> scannedChunks = new HashSet<>(chunks);
        Set<EpisodeKey> trajectoryKeys = new HashSet<>(currentKeys);
        trajectoryKeys.addAll(skippedKeys);

        List<ManifestRow> inScopePrevious = new ArrayList<>();
        List<ManifestRow> carried = new ArrayList<>();
        for (ManifestRow prev : previousRows) {
            if (!scannedChunks.contains(prev.getChunk())) {
                carried.add(prev);
            } else if (skippedKeys.contains(prev.getKey()) && !currentKeys.contains(prev.getKey())) {
                if (prev.getStatus() != Status.DELETED && prev.getStatus() != Status.ORPHAN_VIDEO) {
                    carried.add(prev);
                }
            } else if (prev.getStatus() == Status.DELETED && !trajectoryKeys.contains(prev.getKey())) {
                // still gone: keep the tombstone, it is not re-reported
                carried.add(prev);
            } else {
                inScopePrevious.add(prev);
            }
        }

        List<ManifestRow> deleted = manifestStore.diffDeletions(inScopePrevious, trajectoryKeys, algo);
        List<ManifestRow> orphans = manifestStore.diffOrphans(fs, chunks, trajectoryKeys, algo);

        List<ManifestRow> observed = new ArrayList<>(current.size() + deleted.size() + orphans.size());
        observed.addAll(current);
        observed.addAll(deleted);
        observed.addAll(orphans);
        observed.sort(ManifestRow.MANIFEST_ORDER);

        // 8. sort + persist
        List<ManifestRow> all = new ArrayList<>(observed.size() + carried.size());
        all.addAll(observed);
        all.addAll(carried);
        all.sort(ManifestRow.MANIFEST_ORDER);

        Manifest manifest = Manifest.of(fs.root().toString(), all);
        manifestStore.persist(manifest, manifestPath);

        // 9. metrics + result
        Map<Status, Integer> counts = countByStatus(observed);
        long bytes = current.stream().mapToLong(ManifestRow::getBytesTotal).sum();
        List<ManifestRow> actionable = manifestStore.selectActionable(observed);
        long durationMs = System.currentTimeMillis() - start;
        metrics.recordRunSuccess(durationMs, counts, bytes);

        log.info("[DISCOVERY] run {} done in {}ms: {} row(s), {} actionable, {} carried, counts={}",
                 runId, durationMs, all.size(), actionable.size(), carried.size(), counts);

        return DiscoveryResult.builder()
                .runId(runId)
                .actionableRows(Collections.unmodifiableList(actionable))
                .manifest(manifest)
                .manifestPath(manifestPath)
                .statusCounts(counts)
                .bytesFingerprinted(bytes)
                .durationMs(durationMs)
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* Worker pool                                                          */
    /* ------------------------------------------------------------------ */

    private List<ManifestRow> fingerprintAll(EpisodeScanner scanner, List<TrajectoryFile> files, int workers) {
        if (files.isEmpty()) return new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, files.size()), workerThreadFactory());
        CompletionService<ManifestRow> completion = new ExecutorCompletionService<>(MdcPropagation.wrapExecutor(pool));
        try {
            for (TrajectoryFile f : files) {
                completion.submit(() -> scanner.scan(f.chunk(), f.path()));
            }
            List<ManifestRow> rows = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                rows.add(completion.take().get());
            }
            return rows;
        } catch (ExecutionException e) {
            throw new DiscoveryException("Fingerprint task failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscoveryException("Discovery interrupted while collecting fingerprints", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "discovery-fp-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /* ------------------------------------------------------------------ */
    /* Helpers                                                              */
    /* ------------------------------------------------------------------ */

    /** True when the file is older than {@code since} or vanished while being stat'ed. */
    private static boolean modifiedBefore(Path file, Instant since) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(since);
        } catch (NoSuchFileException e) {
            log.debug("[DISCOVERY] {} vanished during enumeration", file);
            return false;
        } catch (IOException e) {
            // let the scanner record the failure on the row
            log.debug("[DISCOVERY] cannot stat {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static Map<Status, Integer> countByStatus(List<ManifestRow> rows) {
        Map<Status, Integer> counts = new EnumMap<>(Status.class);
        for (ManifestRow row : rows) {
            counts.merge(row.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    private static Path requirePath(Path path, String name) {
        if (path == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return path;
    }

    private record TrajectoryFile(String chunk, Path path) {}
}
