package com.di.neura.discovery.fs;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link EpisodeFileSystem} over a local (or locally mounted) directory tree.
 */
@Slf4j
public class LocalEpisodeFileSystem implements EpisodeFileSystem {

    public static final String DATA_DIR = "data";
    public static final String VIDEOS_DIR = "videos";

    private final Path root;
    private final String trajectoryExtension;

    public LocalEpisodeFileSystem(Path root, String trajectoryExtension) {
        this.root = root.toAbsolutePath().normalize();
        this.trajectoryExtension = trajectoryExtension;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<String> listChunks() {
        List<String> chunks = new ArrayList<>();
        for (Path dir : list(root.resolve(DATA_DIR), EpisodeFileNames.CHUNK_DIR_PREFIX + "*")) {
            if (Files.isDirectory(dir)) {
                chunks.add(EpisodeFileNames.chunkIdFromDirName(dir.getFileName().toString()));
            }
        }
        chunks.sort(Comparator.naturalOrder());
        return chunks;
    }

    @Override
    public List<Path> listTrajectoryFiles(String chunk) {
        Path dir = root.resolve(DATA_DIR).resolve(EpisodeFileNames.chunkDirName(chunk));
        return list(dir, EpisodeFileNames.EPISODE_PREFIX + "*." + trajectoryExtension);
    }

    @Override
    public List<Path> listVideoFiles(String chunk, CameraView view) {
        Path dir = root.resolve(VIDEOS_DIR)
                .resolve(EpisodeFileNames.chunkDirName(chunk))
                .resolve(view.getDirectoryName());
        return list(dir, EpisodeFileNames.EPISODE_PREFIX + "*." + EpisodeFileNames.VIDEO_EXTENSION);
    }

    @Override
    public Path videoPath(String chunk, CameraView view, int episodeIndex) {
        return root.resolve(VIDEOS_DIR)
                .resolve(EpisodeFileNames.chunkDirName(chunk))
                .resolve(view.getDirectoryName())
                .resolve(EpisodeFileNames.episodeFileName(episodeIndex, EpisodeFileNames.VIDEO_EXTENSION));
    }

    /** Glob listing of one directory, sorted by file name. Empty when the directory is missing. */
    private static List<Path> list(Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path p : stream) {
                out.add(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
        out.sort(Comparator.comparing(p -> p.getFileName().toString()));
        log.debug("[FS] {} entries matching {} in {}", out.size(), glob, dir);
        return out;
    }
}
