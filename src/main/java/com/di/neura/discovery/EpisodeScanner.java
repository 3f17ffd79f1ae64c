package com.di.neura.discovery;

import com.di.neura.discovery.fingerprint.FileFingerprint;
import com.di.neura.discovery.fingerprint.Fingerprinter;
import com.di.neura.discovery.fingerprint.StabilityChecker;
import com.di.neura.discovery.fs.CameraView;
import com.di.neura.discovery.fs.EpisodeFileNames;
import com.di.neura.discovery.fs.EpisodeFileSystem;
import com.di.neura.discovery.model.EpisodeKey;
import com.di.neura.discovery.model.ManifestRow;
import com.di.neura.discovery.model.RowDiagnostic;
import com.di.neura.discovery.model.Status;
import com.di.neura.discovery.status.EpisodeObservation;
import com.di.neura.discovery.status.StatusResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Observes one episode: stability of its files, per-file fingerprints and the
 * combined episode fingerprint. Runs on a fingerprinting worker.
 *
 * <p>The row it returns is owned by the caller and has not been compared
 * against any previous run yet: complete episodes come back {@link Status#NEW}.
 * Failures while reading an episode's files (I/O or runtime) are recorded on
 * the row as {@link Status#ERROR}, never thrown.
 */
@Slf4j
class EpisodeScanner {

    static final String TRAJECTORY_PART = "parquet";

    private final EpisodeFileSystem fs;
    private final Fingerprinter     fingerprinter;
    private final StabilityChecker  stabilityChecker;
    private final StatusResolver    statusResolver;
    private final boolean           fullHash;
    private final String            algo;

    EpisodeScanner(EpisodeFileSystem fs,
                   Fingerprinter fingerprinter,
                   StabilityChecker stabilityChecker,
                   StatusResolver statusResolver,
                   boolean fullHash) {
        this.fs               = fs;
        this.fingerprinter    = fingerprinter;
        this.stabilityChecker = stabilityChecker;
        this.statusResolver   = statusResolver;
        this.fullHash         = fullHash;
        this.algo             = Fingerprinter.algorithmTag(fullHash);
    }

    ManifestRow scan(String chunk, Path trajectory) {
        OptionalInt parsed = EpisodeFileNames.parseEpisodeIndex(trajectory);
        if (parsed.isEmpty()) {
            log.warn("[SCAN] cannot parse episode index from {}", trajectory);
            return ManifestRow.builder()
                    .episodeIndex(EpisodeKey.UNPARSEABLE_INDEX)
                    .chunk(chunk)
                    .parquetUri(trajectory.toString())
                    .bytesTotal(0L)
                    .fingerprintAlgo(algo)
                    .discoveredAt(Instant.now())
                    .status(Status.ERROR)
                    .errors(RowDiagnostic.badEpisodeName(trajectory.getFileName().toString()))
                    .build();
        }
        int index = parsed.getAsInt();
        Path front = fs.videoPath(chunk, CameraView.FRONT, index);
        Path wrist = fs.videoPath(chunk, CameraView.WRIST, index);

        boolean frontExists = Files.isRegularFile(front);
        boolean wristExists = Files.isRegularFile(wrist);

        EpisodeObservation.EpisodeObservationBuilder obs = EpisodeObservation.builder()
                .trajectoryExists(true)
                .frontExists(frontExists)
                .wristExists(wristExists)
                .fingerprintAlgo(algo);

        String    fingerprint = null;
        long      bytesTotal  = 0L;
        Throwable failure     = null;
        try {
            obs.trajectoryStable(stabilityChecker.isStable(trajectory))
               .frontStable(!frontExists || stabilityChecker.isStable(front))
               .wristStable(!wristExists || stabilityChecker.isStable(wrist));

            Map<String, FileFingerprint> parts = new TreeMap<>();
            parts.put(TRAJECTORY_PART, fingerprinter.fingerprintFile(trajectory, fullHash));
            if (frontExists) parts.put(CameraView.FRONT.getDirectoryName(), fingerprinter.fingerprintFile(front, fullHash));
            if (wristExists) parts.put(CameraView.WRIST.getDirectoryName(), fingerprinter.fingerprintFile(wrist, fullHash));

            fingerprint = fingerprinter.combine(parts);
            bytesTotal  = parts.values().stream().mapToLong(FileFingerprint::size).sum();
        } catch (IOException | RuntimeException e) {
            failure = e;
            log.warn("[SCAN] {}/{} failed: {}: {}", chunk, trajectory.getFileName(),
                     e.getClass().getSimpleName(), e.getMessage());
        }

        EpisodeObservation observation = obs
                .fingerprint(fingerprint)
                .failure(failure)
                .build();
        Status status = statusResolver.resolve(observation);

        return ManifestRow.builder()
                .episodeIndex(index)
                .chunk(chunk)
                .parquetUri(trajectory.toString())
                .videoFrontUri(frontExists ? front.toString() : null)
                .videoWristUri(wristExists ? wrist.toString() : null)
                .existsFront(frontExists)
                .existsWrist(wristExists)
                .bytesTotal(bytesTotal)
                .fingerprint(fingerprint)
                .fingerprintAlgo(algo)
                .discoveredAt(Instant.now())
                .status(status)
                .errors(failure != null ? RowDiagnostic.fromException(failure) : null)
                .build();
    }
}
